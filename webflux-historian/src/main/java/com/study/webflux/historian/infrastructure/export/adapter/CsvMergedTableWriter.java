package com.study.webflux.historian.infrastructure.export.adapter;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.format.DateTimeFormatter;

import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;
import com.study.webflux.historian.domain.extraction.model.MergedTable;
import com.study.webflux.historian.domain.extraction.port.MergedTableWriter;

/**
 * 병합 테이블을 UTF-8 CSV로 씁니다.
 *
 * <p>
 * 첫 행은 {@code timestamp}와 요청 순서의 태그 이름이며, 결측 값은 빈 필드로 씁니다. 필드는 구분자나 따옴표를 포함할 때만 인용합니다.
 */
public class CsvMergedTableWriter implements MergedTableWriter {

	static final String TIMESTAMP_HEADER = "timestamp";

	private final DateTimeFormatter timestampFormatter;
	private final int decimalPlaces;

	public CsvMergedTableWriter(String timestampPattern, int decimalPlaces) {
		if (decimalPlaces < 0) {
			throw new IllegalArgumentException("decimalPlaces must not be negative: " + decimalPlaces);
		}
		this.timestampFormatter = DateTimeFormatter.ofPattern(timestampPattern);
		this.decimalPlaces = decimalPlaces;
	}

	@Override
	public void write(MergedTable table, OutputStream out) throws IOException {
		Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
		// 스트림을 닫지 않음: 산출물 저장소가 스트림 수명을 관리
		CSVWriter csvWriter = new CSVWriter(writer,
			ICSVWriter.DEFAULT_SEPARATOR,
			ICSVWriter.DEFAULT_QUOTE_CHARACTER,
			ICSVWriter.DEFAULT_ESCAPE_CHARACTER,
			"\n");

		String[] header = new String[table.columnCount()];
		header[0] = TIMESTAMP_HEADER;
		for (int i = 0; i < table.tags().size(); i++) {
			header[i + 1] = table.tags().get(i).value();
		}
		csvWriter.writeNext(header, false);

		String[] row = new String[table.columnCount()];
		for (int r = 0; r < table.rowCount(); r++) {
			row[0] = table.timestampAt(r).format(timestampFormatter);
			for (int c = 0; c < table.tags().size(); c++) {
				row[c + 1] = table.isAbsent(r, c) ? "" : formatValue(table.valueAt(r, c));
			}
			csvWriter.writeNext(row, false);
		}

		csvWriter.flush();
		if (csvWriter.checkError()) {
			throw new IOException("failed to write CSV content", csvWriter.getException());
		}
	}

	String formatValue(double value) {
		if (Double.isInfinite(value)) {
			return String.valueOf(value);
		}
		return BigDecimal.valueOf(value).setScale(decimalPlaces, RoundingMode.HALF_UP).toPlainString();
	}
}
