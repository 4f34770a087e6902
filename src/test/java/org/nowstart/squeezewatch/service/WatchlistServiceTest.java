package org.nowstart.squeezewatch.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.nowstart.squeezewatch.data.dto.WatchedInstrument;
import org.nowstart.squeezewatch.data.property.MonitorProperties;

class WatchlistServiceTest {

    private final WatchlistService service = new WatchlistService(properties(
            List.of("KRW-BTC", "eth", "KRW-BTC"),
            Map.of("KRW-BTC", "비트코인")
    ));

    @Test
    void constructor_normalizesAndDeduplicatesConfiguredMarkets() {
        assertThat(service.markets()).containsExactly("KRW-BTC", "KRW-ETH");
        assertThat(service.size()).isEqualTo(2);
    }

    @Test
    void instruments_fallBackToMarketWhenNoDisplayName() {
        assertThat(service.instruments()).containsExactly(
                new WatchedInstrument("KRW-BTC", "비트코인"),
                new WatchedInstrument("KRW-ETH", "KRW-ETH")
        );
    }

    @Test
    void add_returnsOnlyNewMarketsInOrder() {
        List<String> added = service.add(List.of("xrp", "btc", " sol "));

        assertThat(added).containsExactly("KRW-XRP", "KRW-SOL");
        assertThat(service.markets()).containsExactly("KRW-BTC", "KRW-ETH", "KRW-XRP", "KRW-SOL");
    }

    @Test
    void remove_returnsRemovedMarkets() {
        assertThat(service.remove(List.of("eth", "doge"))).containsExactly("KRW-ETH");
        assertThat(service.markets()).containsExactly("KRW-BTC");
    }

    @Test
    void add_rejectsBlankSymbol() {
        assertThatThrownBy(() -> service.add(List.of(" ")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    static MonitorProperties properties(List<String> watchlist, Map<String, String> displayNames) {
        return new MonitorProperties(
                false,
                Duration.ofMinutes(5),
                Duration.ofHours(1),
                Duration.ofHours(1),
                Duration.ZERO,
                Duration.ofSeconds(30),
                Duration.ofSeconds(10),
                5,
                10,
                100,
                watchlist,
                displayNames
        );
    }
}
