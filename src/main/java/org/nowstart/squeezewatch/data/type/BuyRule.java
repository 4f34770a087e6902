package org.nowstart.squeezewatch.data.type;

public enum BuyRule {
    // 직전 봉 스퀴즈 + 상단 밴드 돌파 + 거래량 증가 + RSI 50~80
    BREAKOUT,
    // RSI 과매수 임계값 초과 + 현재 봉 스퀴즈
    THRESHOLD
}
