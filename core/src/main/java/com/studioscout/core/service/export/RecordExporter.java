package com.studioscout.core.service.export;

import com.studioscout.core.service.BatchResult;

import java.io.IOException;
import java.nio.file.Path;

/** 배치 결과를 파일로 내보내는 책임 (CSV/JSON/오류 CSV) */
public interface RecordExporter {
    /**
     * @param baseDir    출력 루트 (null이면 "out")
     * @param result     배치 결과(레코드 + 오류 + 통계)
     * @param startedIso 배치 시작 시각(ISO-8601, 파일명 타임스탬프에 사용)
     * @return 생성된 파일의 경로
     */
    Path export(Path baseDir, BatchResult result, String startedIso) throws IOException;
}
