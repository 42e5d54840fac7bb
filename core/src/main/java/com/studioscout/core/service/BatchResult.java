package com.studioscout.core.service;

import com.studioscout.core.model.ExtractionError;
import com.studioscout.core.model.FacilityRecord;
import com.studioscout.core.model.ItemState;
import com.studioscout.core.model.ScrapeStats;

import java.net.URI;
import java.util.List;
import java.util.Objects;

/**
 * 배치 출력: 레코드(입력 순서, 실패 로케이터 제외) + 오류 로그(발생 순서) + 로케이터별 종료 상태.
 */
public final class BatchResult {

    /** 로케이터 한 건의 최종 상태 */
    public record ItemOutcome(URI locator, ItemState state) {
        public ItemOutcome {
            Objects.requireNonNull(locator, "locator");
            Objects.requireNonNull(state, "state");
            if (!state.isTerminal()) throw new IllegalArgumentException("outcome must be terminal: " + state);
        }
    }

    private final List<FacilityRecord> records;
    private final List<ExtractionError> errors;
    private final List<ItemOutcome> outcomes;
    private final ScrapeStats.Snapshot stats;

    public BatchResult(List<FacilityRecord> records, List<ExtractionError> errors,
                       List<ItemOutcome> outcomes, ScrapeStats.Snapshot stats) {
        this.records = List.copyOf(records);
        this.errors = List.copyOf(errors);
        this.outcomes = List.copyOf(outcomes);
        this.stats = Objects.requireNonNull(stats, "stats");
    }

    public List<FacilityRecord> getRecords() { return records; }
    public List<ExtractionError> getErrors() { return errors; }
    public List<ItemOutcome> getOutcomes() { return outcomes; }
    public ScrapeStats.Snapshot getStats() { return stats; }

    public long retrievalErrorCount() {
        return errors.stream().filter(ExtractionError::isRetrieval).count();
    }

    public long fieldErrorCount() {
        return errors.size() - retrievalErrorCount();
    }

    /** 입력이 있었는데 한 건도 가져오지 못함 */
    public boolean allFailed() {
        return !outcomes.isEmpty() && outcomes.stream().allMatch(o -> o.state() == ItemState.LOAD_FAILED);
    }
}
