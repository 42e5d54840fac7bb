package com.studioscout.core.model;

import java.util.List;

/**
 * 주소 분해 결과. rawSegments는 쉼표 분할 원본(공백 포함 그대로).
 * postalCode/city는 두 번째 세그먼트의 고정 위치 토큰, street는 첫 세그먼트.
 */
public record AddressParts(List<String> rawSegments, String postalCode, String city, String street) {
    public AddressParts {
        rawSegments = List.copyOf(rawSegments);
    }
}
