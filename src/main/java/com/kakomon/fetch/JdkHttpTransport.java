package com.kakomon.fetch;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * 模块说明：JdkHttpTransport（class）。
 * 主要职责：基于 java.net.http 发送单次请求，GET 参数拼接到查询串，POST 参数作为表单提交。
 * 使用建议：重试、限流与缓存由 Fetcher 负责，这里只做一次往返。
 */
public class JdkHttpTransport implements HttpTransport {
    private final HttpClient client;
    private final String userAgent;

    public JdkHttpTransport(String userAgent, Duration connectTimeout) {
        this.userAgent = userAgent == null || userAgent.isBlank() ? "kakomon-harvester/1.0" : userAgent;
        this.client = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public TransportResponse send(FetchRequest request, Duration timeout) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(request.targetUrl()))
                .timeout(timeout)
                .header("User-Agent", userAgent);
        for (Map.Entry<String, String> header : request.headers.entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        if (request.method == FetchRequest.Method.POST) {
            builder.header("Content-Type", "application/x-www-form-urlencoded; charset=UTF-8");
            builder.POST(HttpRequest.BodyPublishers.ofString(request.encodedParams()));
        } else {
            builder.GET();
        }
        HttpResponse<String> resp = client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        return new TransportResponse(resp.statusCode(), resp.body(), resp.headers().map());
    }
}
