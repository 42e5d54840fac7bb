package com.studioscout.core.model;

import java.util.Objects;

/** "4.8 (123)" → scoreText "4.8", countText "123". 텍스트 그대로 보관(숫자 변환 안 함). */
public record Rating(String scoreText, String countText) {
    public Rating {
        Objects.requireNonNull(scoreText, "scoreText");
        Objects.requireNonNull(countText, "countText");
    }
}
