package org.nowstart.squeezewatch.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.squeezewatch.data.dto.WatchedInstrument;
import org.nowstart.squeezewatch.data.property.MonitorProperties;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class WatchlistService {

    private final Map<String, String> displayNames;
    private final CopyOnWriteArrayList<String> markets = new CopyOnWriteArrayList<>();

    public WatchlistService(MonitorProperties monitorProperties) {
        this.displayNames = Map.copyOf(monitorProperties.displayNames());
        add(monitorProperties.watchlist());
    }

    public List<String> markets() {
        return List.copyOf(markets);
    }

    public List<WatchedInstrument> instruments() {
        return markets.stream()
                .map(market -> new WatchedInstrument(market, displayName(market)))
                .toList();
    }

    public int size() {
        return markets.size();
    }

    public String displayName(String market) {
        return displayNames.getOrDefault(market, market);
    }

    public List<String> add(List<String> symbols) {
        List<String> added = new ArrayList<>();
        for (String symbol : symbols) {
            String market = MarketDataService.normalizeMarket(symbol);
            if (markets.addIfAbsent(market)) {
                added.add(market);
                log.info("event=watchlist_added market={}", market);
            }
        }
        return added;
    }

    public List<String> remove(List<String> symbols) {
        List<String> removed = new ArrayList<>();
        for (String symbol : symbols) {
            String market = MarketDataService.normalizeMarket(symbol);
            if (markets.remove(market)) {
                removed.add(market);
                log.info("event=watchlist_removed market={}", market);
            }
        }
        return removed;
    }
}
