package com.studioscout.core.util;

/**
 * 배치 진행률 콜백. 워커 스레드에서 호출될 수 있으니 구현은 스레드 세이프해야 한다.
 * 콜백 예외는 배치를 멈추지 않는다(드라이버가 debug로 남기고 무시).
 */
@FunctionalInterface
public interface ProgressListener {

    enum Phase { LOAD, EXTRACT }

    /**
     * @param phase LOAD는 배치 시작 시 한 번(done=0), EXTRACT는 로케이터 한 건이 끝날 때마다
     * @param done  끝난 로케이터 수
     * @param total 전체 로케이터 수(빈 배치면 0)
     */
    void onProgress(Phase phase, int done, int total);

    ProgressListener NONE = (phase, done, total) -> {};
}
