package villagecompute.jobengine.jobs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.jobengine.data.models.Job;
import villagecompute.jobengine.exceptions.PermanentExecutionException;
import villagecompute.jobengine.exceptions.TransientExecutionException;
import villagecompute.jobengine.util.PayloadValues;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Calls an HTTP endpoint. Used by tenants to ping their own systems on a schedule.
 *
 * <p>
 * Runs inline when fired by a schedule, queued when enqueued directly. A 2xx response succeeds; 408, 429 and 5xx are
 * retried; any other status is a permanent failure.
 *
 * <p>
 * <b>Payload Structure:</b>
 *
 * <pre>
 * {
 *   "url": "https://example.com/hooks/nightly",
 *   "method": "POST",                 // optional, default POST
 *   "headers": {"X-Api-Key": "..."},  // optional
 *   "body": {"any": "json"}           // optional, sent as application/json
 * }
 * </pre>
 */
@ApplicationScoped
public class WebhookJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(WebhookJobHandler.class);

    public static final String TYPE = "webhook";

    private static final int MAX_RESPONSE_CHARS = 2000;

    @Inject
    ObjectMapper objectMapper;

    @ConfigProperty(
            name = "jobengine.handlers.http-timeout-seconds",
            defaultValue = "30")
    long timeoutSeconds;

    private final HttpClient httpClient = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(10)).build();

    @Override
    public String handlesType() {
        return TYPE;
    }

    @Override
    public ExecutionMode executionMode() {
        return ExecutionMode.INLINE;
    }

    @Override
    public String description() {
        return "Sends an HTTP request to a configured URL";
    }

    @Override
    public Map<String, Object> execute(Job job, JobContext context) throws InterruptedException {
        String url = PayloadValues.requireString(job.payload, "url");
        String method = PayloadValues.optionalString(job.payload, "method", "POST").toUpperCase(Locale.ROOT);
        Map<String, Object> headers = PayloadValues.optionalMap(job.payload, "headers");
        Object body = job.payload == null ? null : job.payload.get("body");

        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new PermanentExecutionException("Invalid webhook url: " + url, e);
        }
        if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
            throw new PermanentExecutionException("Webhook url must be http or https: " + url);
        }

        HttpRequest.Builder request = HttpRequest.newBuilder().uri(uri).timeout(Duration.ofSeconds(timeoutSeconds))
                .method(method, bodyPublisher(body));
        if (body != null) {
            request.header("Content-Type", "application/json");
        }
        headers.forEach((name, value) -> request.header(name, String.valueOf(value)));

        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransientExecutionException("Webhook " + method + " " + url + " failed: " + e.getMessage(), e);
        }

        int status = response.statusCode();
        LOG.infof("Webhook %s %s returned %d", method, url, status);
        if (status == 408 || status == 429 || status >= 500) {
            throw new TransientExecutionException("Webhook " + method + " " + url + " returned HTTP " + status);
        }
        if (status < 200 || status >= 300) {
            throw new PermanentExecutionException("Webhook " + method + " " + url + " returned HTTP " + status);
        }

        String responseBody = response.body() == null ? "" : response.body();
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status_code", status);
        result.put("response",
                responseBody.length() > MAX_RESPONSE_CHARS ? responseBody.substring(0, MAX_RESPONSE_CHARS) : responseBody);
        return result;
    }

    private HttpRequest.BodyPublisher bodyPublisher(Object body) {
        if (body == null) {
            return HttpRequest.BodyPublishers.noBody();
        }
        try {
            String json = body instanceof String text ? text : objectMapper.writeValueAsString(body);
            return HttpRequest.BodyPublishers.ofString(json);
        } catch (JsonProcessingException e) {
            throw new PermanentExecutionException("Webhook body is not serializable", e);
        }
    }
}
