package org.scriptonbasestar.sync.store.file;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * 시계열 한 점. JSON 에서는 {@code ["2024-03-01T14:30:00.000100Z", 4.25]} 형태.
 *
 * @author archmagece
 * @since 2025-02
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"at", "value"})
public class PointDocument {

	private String at;
	private double value;

	public PointDocument() {
	}

	public PointDocument(String at, double value) {
		this.at = at;
		this.value = value;
	}

	public String getAt() {
		return at;
	}

	public void setAt(String at) {
		this.at = at;
	}

	public double getValue() {
		return value;
	}

	public void setValue(double value) {
		this.value = value;
	}
}
