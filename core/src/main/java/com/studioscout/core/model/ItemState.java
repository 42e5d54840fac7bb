package com.studioscout.core.model;

/**
 * 로케이터 한 건의 처리 상태.
 * PENDING → LOADING → (LOAD_FAILED | PARSED) → EXTRACTING → DONE
 */
public enum ItemState {
    PENDING,
    LOADING,
    LOAD_FAILED,
    PARSED,
    EXTRACTING,
    DONE;

    public boolean isTerminal() { return this == DONE || this == LOAD_FAILED; }

    /** 허용된 전이인지 */
    public boolean canMoveTo(ItemState next) {
        return switch (this) {
            case PENDING -> next == LOADING;
            case LOADING -> next == LOAD_FAILED || next == PARSED;
            case PARSED -> next == EXTRACTING;
            case EXTRACTING -> next == DONE;
            case LOAD_FAILED, DONE -> false;
        };
    }
}
