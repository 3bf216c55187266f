/*
 *   Copyright Calrissian Hooks Contributors
 *
 *   Licensed under the Apache License, Version 2.0 (the "License").
 *   You may not use this file except in compliance with the License.
 *   You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *   Unless required by applicable law or agreed to in writing, software
 *   distributed under the License is distributed on an "AS IS" BASIS,
 *   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *   See the License for the specific language governing permissions and
 *   limitations under the License.
 */

package org.eoepca.calrissian.http;

import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;

import org.eoepca.calrissian.env.EnvironmentVariables;

/**
 * Builds HTTP clients that honor the HTTP_PROXY variable as it is set at the time of the call.
 *
 * Clients are meant to be built per call, so that hooks which temporarily unset HTTP_PROXY get a direct connection.
 */
public final class HttpClients {

    public static final String HTTP_PROXY = "HTTP_PROXY";

    private static final int DEFAULT_PROXY_PORT = 80;

    private HttpClients() {}

    public static HttpClient forEnvironment(EnvironmentVariables env) {
        HttpClient.Builder builder = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL);
        String proxy = env.get(HTTP_PROXY);
        if (proxy == null || proxy.isEmpty()) {
            builder.proxy(HttpClient.Builder.NO_PROXY);
        } else {
            builder.proxy(ProxySelector.of(parseProxyAddress(proxy)));
        }
        return builder.build();
    }

    // package-private for test visibility
    static InetSocketAddress parseProxyAddress(String proxy) {
        String withScheme = proxy.contains("://") ? proxy : "http://" + proxy;
        URI uri = URI.create(withScheme);
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("Unable to parse proxy address: " + proxy);
        }
        int port = uri.getPort() == -1 ? DEFAULT_PROXY_PORT : uri.getPort();
        return InetSocketAddress.createUnresolved(uri.getHost(), port);
    }
}
