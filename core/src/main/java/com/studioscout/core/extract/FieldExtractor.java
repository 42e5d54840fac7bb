package com.studioscout.core.extract;

/**
 * 의미 필드 하나를 뽑는 순수 함수.
 * 공유 상태를 바꾸지 않으므로 여러 워커에서 동시에 써도 된다.
 */
public interface FieldExtractor<T> {

    /** 오류 로그/내보내기에서 쓰는 필드 이름 */
    String fieldName();

    FieldResult<T> extract(PageTree tree);
}
