package alertflow.utils;

import com.alibaba.fastjson2.JSON;
import okhttp3.Headers;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.apache.commons.collections4.MapUtils;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeUnit;

public class HttpUtils {

    private static final MediaType JSON_TYPE = MediaType.parse("application/json; charset=utf-8");

    private static final OkHttpClient client = new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .writeTimeout(10, TimeUnit.SECONDS)
            .readTimeout(30, TimeUnit.SECONDS)
            .build();

    private HttpUtils() {
    }

    /**
     * POST JSON 请求,非 2xx 响应抛出 IOException,返回响应体
     */
    public static String postJson(String url, Map<String, String> headers, Object payload) throws IOException {
        String jsonBody = payload instanceof String ? (String) payload : JSON.toJSONString(payload);
        RequestBody body = RequestBody.create(jsonBody, JSON_TYPE);

        Request.Builder builder = new Request.Builder()
                .url(url)
                .post(body);
        if (MapUtils.isNotEmpty(headers)) {
            builder.headers(Headers.of(headers));
        }
        return execute(builder.build());
    }

    private static String execute(Request request) throws IOException {
        try (Response response = client.newCall(request).execute()) {
            String result = response.body() == null ? "" : response.body().string();
            if (!response.isSuccessful()) {
                throw new IOException("Unexpected code " + response.code() + ": " + result);
            }
            return result;
        }
    }
}
