package space.ketterling.airsense.weather;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.airsense.cache.ResultCache;
import space.ketterling.airsense.metrics.OutcomeMetrics;
import space.ketterling.airsense.model.WeatherReading;
import space.ketterling.airsense.source.WeatherProvider;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.*;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * HTTP client for the OpenWeather 5-day / 3-hour forecast endpoint.
 *
 * <p>
 * The 3-hourly steps are expanded to hourly readings. Raw responses are cached per city
 * for {@link #RESPONSE_TTL}.
 * </p>
 */
public final class OpenWeatherClient implements WeatherProvider {
    private static final Logger log = LoggerFactory.getLogger(OpenWeatherClient.class);

    static final String SOURCE = "upstream:openweather";
    static final Duration RESPONSE_TTL = Duration.ofMinutes(30);
    private static final double MPS_TO_KMH = 3.6;

    private final HttpClient http;
    private final ObjectMapper om;
    private final String apiKey;
    private final String baseUrl;
    private final OutcomeMetrics metrics;
    private final Clock clock;
    private final ResultCache<String, JsonNode> responses;

    /**
     * Creates a client against the public OpenWeather API.
     */
    public OpenWeatherClient(String apiKey, ObjectMapper om, OutcomeMetrics metrics, Clock clock) {
        this(apiKey, "https://api.openweathermap.org/data/2.5", om, metrics, clock);
    }

    OpenWeatherClient(String apiKey, String baseUrl, ObjectMapper om, OutcomeMetrics metrics, Clock clock) {
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
        this.om = om;
        this.metrics = metrics;
        this.clock = clock;
        this.responses = new ResultCache<>(RESPONSE_TTL, clock);
        this.http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public List<WeatherReading> fetchForecast(String city, int hours) throws Exception {
        JsonNode body = responses.get(city).orElse(null);
        if (body == null) {
            body = getJson(baseUrl + "/forecast?units=metric&q="
                    + URLEncoder.encode(city, StandardCharsets.UTF_8) + "&appid=" + apiKey);
            responses.set(city, body);
        }
        return toHourly(body, clock.instant().truncatedTo(ChronoUnit.HOURS), hours);
    }

    /**
     * Performs a GET request and parses JSON, recording the outcome.
     */
    private JsonNode getJson(String url) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(20))
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (Exception e) {
            metrics.record(SOURCE, false);
            throw e;
        }
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            metrics.record(SOURCE, false);
            // never log the url: it carries the api key
            throw new IllegalStateException("OpenWeather request failed: " + resp.statusCode()
                    + " body=" + resp.body());
        }
        metrics.record(SOURCE, true);
        return om.readTree(resp.body());
    }

    /**
     * Expands the 3-hourly {@code list} into {@code hours} hourly readings starting at
     * {@code start}. Each hour takes the latest step at or before it, or the first step.
     */
    static List<WeatherReading> toHourly(JsonNode body, Instant start, int hours) {
        JsonNode list = body.path("list");
        List<Step> steps = new ArrayList<>();
        for (JsonNode n : list) {
            steps.add(new Step(
                    Instant.ofEpochSecond(n.path("dt").asLong()),
                    number(n.path("main").path("temp")),
                    number(n.path("main").path("humidity")),
                    scale(number(n.path("wind").path("speed")), MPS_TO_KMH),
                    scale(number(n.path("pop")), 100.0)));
        }
        if (steps.isEmpty()) {
            log.warn("OpenWeather response had no forecast steps");
            return List.of();
        }

        List<WeatherReading> out = new ArrayList<>(hours);
        int idx = 0;
        for (int i = 0; i < hours; i++) {
            Instant t = start.plus(Duration.ofHours(i));
            while (idx + 1 < steps.size() && !steps.get(idx + 1).at.isAfter(t)) {
                idx++;
            }
            Step s = steps.get(idx);
            out.add(new WeatherReading(i, t, s.temperature, s.humidity, s.windSpeed, s.precipitationProb));
        }
        return out;
    }

    private static Double number(JsonNode n) {
        return n == null || n.isMissingNode() || n.isNull() ? null : n.asDouble();
    }

    private static Double scale(Double v, double factor) {
        return v == null ? null : v * factor;
    }

    private record Step(Instant at, Double temperature, Double humidity, Double windSpeed, Double precipitationProb) {
    }
}
