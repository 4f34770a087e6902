package org.nowstart.squeezewatch.data.exception;

import lombok.Getter;

@Getter
public class MarketDataException extends RuntimeException {

    private final String market;
    private final String code;

    public MarketDataException(String market, String code, String message) {
        super(message);
        this.market = market;
        this.code = code;
    }

    public MarketDataException(String market, String code, String message, Throwable cause) {
        super(message, cause);
        this.market = market;
        this.code = code;
    }
}
