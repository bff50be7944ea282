package com.nasexporter.collectors.nifcloud;

import com.nasexporter.core.model.Credentials;
import software.amazon.awssdk.http.ContentStreamProvider;
import software.amazon.awssdk.http.SdkHttpMethod;
import software.amazon.awssdk.http.SdkHttpRequest;
import software.amazon.awssdk.http.auth.aws.signer.AwsV4HttpSigner;
import software.amazon.awssdk.http.auth.spi.signer.HttpSigner;
import software.amazon.awssdk.http.auth.spi.signer.SignedRequest;
import software.amazon.awssdk.identity.spi.AwsCredentialsIdentity;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Signs NIFCLOUD API requests with the AWS-compatible Signature Version 4 scheme, using the AWS
 * SDK signer.
 */
public final class SignatureV4Signer {
    // Set by java.net.http itself; HttpRequest.Builder rejects them.
    private static final Set<String> TRANSPORT_HEADERS = Set.of("host", "content-length", "connection", "expect", "upgrade");

    private final AwsV4HttpSigner signer = AwsV4HttpSigner.create();
    private final AwsCredentialsIdentity identity;
    private final String region;
    private final String service;

    public SignatureV4Signer(Credentials credentials, String region, String service) {
        this.identity = AwsCredentialsIdentity.create(credentials.accessKeyId(), credentials.secretAccessKey());
        this.region = region;
        this.service = service;
    }

    /**
     * Returns the headers to add to the request besides {@code Content-Type}, keyed by header
     * name: at least {@code X-Amz-Date} and {@code Authorization}.
     */
    public Map<String, String> sign(String method, URI uri, String contentType, byte[] body, Instant now) {
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("endpoint has no host: " + uri);
        }
        SdkHttpRequest request = SdkHttpRequest.builder()
                .method(SdkHttpMethod.fromValue(method.toUpperCase(Locale.ROOT)))
                .uri(uri)
                .putHeader("Content-Type", contentType)
                .build();

        SignedRequest signed = signer.sign(r -> r
                .identity(identity)
                .request(request)
                .payload(ContentStreamProvider.fromByteArray(body))
                .putProperty(AwsV4HttpSigner.SERVICE_SIGNING_NAME, service)
                .putProperty(AwsV4HttpSigner.REGION_NAME, region)
                .putProperty(HttpSigner.SIGNING_CLOCK, Clock.fixed(now, ZoneOffset.UTC)));

        Map<String, String> headers = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> header : signed.request().headers().entrySet()) {
            String name = header.getKey().toLowerCase(Locale.ROOT);
            if (name.equals("content-type") || TRANSPORT_HEADERS.contains(name) || header.getValue().isEmpty()) {
                continue;
            }
            headers.put(header.getKey(), header.getValue().get(0));
        }
        return headers;
    }
}
