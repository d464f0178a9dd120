package org.atomicswap.controller.swap;

@SuppressWarnings("serial")
public class SwapException extends Exception {

	public SwapException(String message) {
		super(message);
	}

	/** Malformed request, e.g. non-positive amount or secret not matching hashlock. */
	public static class ValidationException extends SwapException {
		public ValidationException(String message) {
			super(message);
		}
	}

	/** Swap is not in a state that allows the requested action, or was changed concurrently. */
	public static class InvalidStateException extends SwapException {
		public InvalidStateException(String message) {
			super(message);
		}
	}

	public static class NotFoundException extends SwapException {
		public NotFoundException(String message) {
			super(message);
		}
	}

	/** Refund requested before the leg's timelock has passed. */
	public static class TimelockNotExpiredException extends SwapException {
		private final long timelock;

		public TimelockNotExpiredException(String message, long timelock) {
			super(message);
			this.timelock = timelock;
		}

		public long getTimelock() {
			return this.timelock;
		}
	}

}
