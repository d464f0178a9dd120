package org.atomicswap.crosschain;

@SuppressWarnings("serial")
public class SettlementBackendException extends Exception {

	public SettlementBackendException() {
		super();
	}

	public SettlementBackendException(String message) {
		super(message);
	}

	public SettlementBackendException(String message, Throwable cause) {
		super(message, cause);
	}

	/** Transient failure, e.g. node unreachable or call timed out. Safe to retry for idempotent calls. */
	public static class UnavailableException extends SettlementBackendException {
		public UnavailableException() {
			super();
		}

		public UnavailableException(String message) {
			super(message);
		}

		public UnavailableException(String message, Throwable cause) {
			super(message, cause);
		}
	}

	/** Backend refused the action, e.g. insufficient funds or bad address. */
	public static class RejectedException extends SettlementBackendException {
		private final Integer daemonErrorCode;

		public RejectedException(String message) {
			super(message);
			this.daemonErrorCode = null;
		}

		public RejectedException(int errorCode, String message) {
			super(message);
			this.daemonErrorCode = errorCode;
		}

		public Integer getDaemonErrorCode() {
			return this.daemonErrorCode;
		}
	}

}
