package com.studioscout.core.model;

/** 연락처 분류. label은 내보내기 컬럼 헤더. */
public enum ContactKind {
    EMAIL("E-Mail"),
    HOMEPAGE("Homepage"),
    PHONE("Telefon");

    private final String label;

    ContactKind(String label) { this.label = label; }

    public String label() { return label; }
}
