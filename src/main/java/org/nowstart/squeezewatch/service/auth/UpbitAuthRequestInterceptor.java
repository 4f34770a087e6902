package org.nowstart.squeezewatch.service.auth;

import feign.RequestInterceptor;
import feign.RequestTemplate;
import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class UpbitAuthRequestInterceptor implements RequestInterceptor {

    private static final String USER_AGENT = "squeezewatch/1.0";

    private final UpbitJwtSigner upbitJwtSigner;

    @Override
    public void apply(RequestTemplate template) {
        template.header("Accept", "application/json");
        template.header("User-Agent", USER_AGENT);
        if (!upbitJwtSigner.isEnabled()) {
            return;
        }
        template.header("Authorization", "Bearer " + upbitJwtSigner.createToken(canonicalQuery(template)));
    }

    // Keys sorted, repeated keys expanded in order, empty values skipped.
    String canonicalQuery(RequestTemplate template) {
        Map<String, Collection<String>> queries = template.queries();
        if (queries == null || queries.isEmpty()) {
            return "";
        }

        return new TreeMap<>(queries).entrySet()
                .stream()
                .filter(entry -> entry.getValue() != null)
                .flatMap(entry -> entry.getValue()
                        .stream()
                        .filter(value -> value != null && !value.isEmpty())
                        .map(value -> entry.getKey() + "=" + value))
                .collect(Collectors.joining("&"));
    }
}
