package com.study.webflux.historian.domain.extraction.port;

import java.io.IOException;
import java.io.OutputStream;

import com.study.webflux.historian.domain.extraction.model.MergedTable;

/** 병합 테이블을 구분자 텍스트로 직렬화합니다. */
public interface MergedTableWriter {

	void write(MergedTable table, OutputStream out) throws IOException;
}
