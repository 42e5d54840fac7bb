// IDocumentLoader.java
package com.studioscout.core.api;

import com.studioscout.core.http.RetrievalException;
import com.studioscout.core.model.FetchedPage;
import java.net.URI;

/** 문서 로더 최소 계약: 로케이터를 받아 원문 페이지를 돌려주거나 RetrievalException으로 실패한다. */
public interface IDocumentLoader extends AutoCloseable {
    FetchedPage fetch(URI locator) throws RetrievalException;
    @Override default void close() throws Exception {}
}
