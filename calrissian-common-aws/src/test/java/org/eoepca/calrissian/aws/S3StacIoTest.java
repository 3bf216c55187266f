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

package org.eoepca.calrissian.aws;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.easymock.Capture;
import org.easymock.EasyMock;
import org.easymock.IMocksControl;
import org.eoepca.calrissian.stac.StacIo;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;

public class S3StacIoTest {

    private static final String CATALOG = "{\"type\": \"Catalog\", \"id\": \"catalog\"}";

    private IMocksControl mockery;
    private S3Client s3;
    private StacIo fallback;

    @BeforeEach
    public void setup() {
        mockery = EasyMock.createControl();
        s3 = mockery.createMock(S3Client.class);
        fallback = mockery.createMock(StacIo.class);
    }

    private void expectGet(String bucket, String key, String content) {
        GetObjectRequest request = GetObjectRequest.builder().bucket(bucket).key(key).build();
        EasyMock.expect(s3.getObjectAsBytes(request))
                .andReturn(ResponseBytes.fromByteArray(GetObjectResponse.builder().build(),
                                                       content.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    public void readsFromBucketNamedInUri() throws IOException {
        expectGet("results", "run-1/catalog.json", CATALOG);

        mockery.replay();
        S3StacIo io = new S3StacIo(s3, null, fallback);
        Assertions.assertEquals(CATALOG, io.readText("s3://results/run-1/catalog.json"));
        mockery.verify();
    }

    @Test
    public void accessPointOverridesBucket() throws IOException {
        expectGet("ws-alice", "run-1/catalog.json", CATALOG);

        mockery.replay();
        S3StacIo io = new S3StacIo(s3, "ws-alice", fallback);
        Assertions.assertEquals(CATALOG, io.readText("s3://results/run-1/catalog.json"));
        mockery.verify();
    }

    @Test
    public void emptyAccessPointIsIgnored() throws IOException {
        expectGet("results", "run-1/catalog.json", CATALOG);

        mockery.replay();
        S3StacIo io = new S3StacIo(s3, "", fallback);
        Assertions.assertEquals(CATALOG, io.readText("s3://results/run-1/catalog.json"));
        mockery.verify();
    }

    @Test
    public void delegatesOtherSchemesToFallback() throws IOException {
        EasyMock.expect(fallback.readText("/tmp/out/catalog.json")).andReturn(CATALOG);

        mockery.replay();
        S3StacIo io = new S3StacIo(s3, "ws-alice", fallback);
        Assertions.assertEquals(CATALOG, io.readText("/tmp/out/catalog.json"));
        mockery.verify();
    }

    @Test
    public void wrapsSdkExceptions() {
        GetObjectRequest request = GetObjectRequest.builder().bucket("results").key("run-1/catalog.json").build();
        EasyMock.expect(s3.getObjectAsBytes(request)).andThrow(NoSuchKeyException.builder().message("missing").build());

        mockery.replay();
        S3StacIo io = new S3StacIo(s3, null, fallback);
        IOException e = Assertions.assertThrows(IOException.class, () -> io.readText("s3://results/run-1/catalog.json"));
        Assertions.assertTrue(e.getCause() instanceof NoSuchKeyException);
        mockery.verify();
    }

    @Test
    public void writesGeoJson() throws IOException {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket("results")
                .key("run-1/catalog.json")
                .contentType(S3StacIo.GEO_JSON_CONTENT_TYPE)
                .build();
        Capture<RequestBody> body = EasyMock.newCapture();
        EasyMock.expect(s3.putObject(EasyMock.eq(request), EasyMock.capture(body)))
                .andReturn(PutObjectResponse.builder().build());

        mockery.replay();
        S3StacIo io = new S3StacIo(s3, null, fallback);
        io.writeText("s3://results/run-1/catalog.json", CATALOG);
        mockery.verify();

        byte[] written = body.getValue().contentStreamProvider().newStream().readAllBytes();
        Assertions.assertEquals(CATALOG, new String(written, StandardCharsets.UTF_8));
    }

    @Test
    public void closeReleasesClientAndFallback() throws IOException {
        s3.close();
        EasyMock.expectLastCall();
        fallback.close();
        EasyMock.expectLastCall();

        mockery.replay();
        new S3StacIo(s3, null, fallback).close();
        mockery.verify();
    }
}
