package io.vena.absence.exceptions;

import lombok.Getter;

/**
 * Thrown when an operation is attempted on an object that forbids it,
 * such as serializing an {@link io.vena.absence.AbsenceMarker AbsenceMarker}.
 */
@Getter
public class OperationValidityException extends UnsupportedOperationException {
	private final String operationName;

	public OperationValidityException(String operationName) {
		super("Operation '" + operationName + "' is not valid on this object.");
		this.operationName = operationName;
	}
}
