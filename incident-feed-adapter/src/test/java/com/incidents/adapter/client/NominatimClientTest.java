package com.incidents.adapter.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.incidents.adapter.config.IncidentProperties;
import com.incidents.adapter.model.Coordinates;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("NominatimClient")
class NominatimClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();
    private IncidentProperties properties;

    @BeforeEach
    void setUp() {
        properties = new IncidentProperties();
        properties.getGeocoder().setMinInterval(Duration.ZERO);
        properties.getGeocoder().setTimeout(Duration.ofSeconds(2));
    }

    private NominatimClient clientReturning(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://geocoder.test")
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new NominatimClient(webClient, new ObjectMapper(), properties);
    }

    @Test
    @DisplayName("Should send a country-scoped bounded search and read string coordinates")
    void shouldReadFirstCandidate() {
        NominatimClient client = clientReturning(HttpStatus.OK,
                "[{\"lat\":\"50.0755\",\"lon\":\"14.4378\"},{\"lat\":\"49.0\",\"lon\":\"16.0\"}]");

        assertThat(client.search("Praha")).contains(new Coordinates(50.0755, 14.4378));

        String query = requests.get(0).url().getQuery();
        assertThat(requests.get(0).url().getPath()).isEqualTo("/search");
        assertThat(query).contains("format=json", "limit=3", "q=Praha", "countrycodes=cz", "bounded=1",
                "viewbox=12.09,51.06,18.87,48.55");
    }

    @Test
    @DisplayName("Should accept numeric coordinates")
    void shouldReadNumericCoordinates() {
        NominatimClient client = clientReturning(HttpStatus.OK, "[{\"lat\":49.19,\"lon\":16.61}]");

        assertThat(client.search("Brno")).contains(new Coordinates(49.19, 16.61));
    }

    @Test
    @DisplayName("Should report no match for an empty array or unparseable coordinates")
    void shouldReturnEmptyWhenNoUsableCandidate() {
        assertThat(clientReturning(HttpStatus.OK, "[]").search("Nowhere")).isEmpty();
        assertThat(clientReturning(HttpStatus.OK, "[{\"lat\":\"n/a\",\"lon\":\"14.0\"}]").search("Odd")).isEmpty();
    }

    @Test
    @DisplayName("Should raise GeocoderException on HTTP errors and malformed bodies")
    void shouldFailOnUpstreamErrors() {
        assertThatThrownBy(() -> clientReturning(HttpStatus.TOO_MANY_REQUESTS, "slow down").search("Praha"))
                .isInstanceOf(NominatimClient.GeocoderException.class);
        assertThatThrownBy(() -> clientReturning(HttpStatus.OK, "{not json").search("Praha"))
                .isInstanceOf(NominatimClient.GeocoderException.class);
    }
}
