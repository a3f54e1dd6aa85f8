package com.aind.metadata.client;

import com.aind.metadata.model.Registry;
import com.aind.metadata.model.RegistryLookupResult;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import static org.assertj.core.api.Assertions.assertThat;

class MgiClientTest {

    @Test
    void okSummaryPageCountsAsFound() {
        StubExchange exchange = new StubExchange().html("/quicksearch/summary", "<html>Ai14</html>");
        MgiClient client = new MgiClient(exchange.webClient(), StubExchange.BASE_URL);

        RegistryLookupResult result = client.lookup("Ai14").block();

        assertThat(result.getRegistry()).isEqualTo(Registry.MGI);
        assertThat(result.isFound()).isTrue();
        assertThat(result.getStatusCode()).isEqualTo(200);
        assertThat(result.getUrl()).isEqualTo("http://registry.test/quicksearch/summary?queryType=exactPhrase&query=Ai14");
    }

    @Test
    void otherStatusIsNotFoundButNotFailed() {
        StubExchange exchange = new StubExchange().status("/quicksearch/summary", HttpStatus.SERVICE_UNAVAILABLE);
        MgiClient client = new MgiClient(exchange.webClient(), StubExchange.BASE_URL);

        RegistryLookupResult result = client.lookup("Ai14").block();

        assertThat(result.isFound()).isFalse();
        assertThat(result.isFailed()).isFalse();
        assertThat(result.getStatusCode()).isEqualTo(503);
    }
}
