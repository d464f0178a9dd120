package org.atomicswap.data.swap;

import java.math.BigDecimal;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;
import javax.xml.bind.annotation.XmlTransient;

import org.atomicswap.crosschain.SupportedAsset;

import io.swagger.v3.oas.annotations.media.Schema;

// All properties to be converted to JSON via JAXB
@XmlAccessorType(XmlAccessType.FIELD)
public class SwapOfferData {

	private String swapId;

	private SwapStatus status;

	private SupportedAsset initiatorAsset;
	@Schema(description = "amount in initiator asset units", type = "number")
	private BigDecimal initiatorAmount;

	private SupportedAsset acceptorAsset;
	@Schema(description = "amount in acceptor asset units", type = "number")
	private BigDecimal acceptorAmount;

	private String initiatorAddress;
	private String acceptorAddress;

	@Schema(description = "lowercase hex SHA-256 of the swap secret")
	private String hashlock;

	// Never expose this via API - only revealed by initiator claim
	@XmlTransient
	@Schema(hidden = true)
	private byte[] secret;

	@Schema(description = "initiator leg refundable after this time (ms since epoch)")
	private long initiatorTimelock;
	@Schema(description = "acceptor leg refundable after this time (ms since epoch), always before initiatorTimelock")
	private long acceptorTimelock;

	private String initiatorTxid;
	private String acceptorTxid;

	private long createdAt;
	private Long acceptedAt;
	private Long initiatorClaimedAt;
	private Long completedAt;

	private Long initiatorRefundedAt;
	private Long acceptorRefundedAt;

	private String lastFailure;
	private Long lastFailureAt;

	@Schema(description = "settlement step submitted but not yet recorded, e.g. lock_initiator")
	private String pendingAction;
	private Long pendingSince;

	private long updatedAt;

	// Internal use - optimistic concurrency counter
	@XmlTransient
	@Schema(hidden = true)
	private int version;

	protected SwapOfferData() {
		/* JAXB */
	}

	/** Constructs freshly created offer. */
	public SwapOfferData(String swapId, SupportedAsset initiatorAsset, BigDecimal initiatorAmount,
			SupportedAsset acceptorAsset, BigDecimal acceptorAmount, String initiatorAddress,
			String hashlock, byte[] secret, long initiatorTimelock, long acceptorTimelock, long createdAt) {
		this(swapId, SwapStatus.OFFERED, initiatorAsset, initiatorAmount, acceptorAsset, acceptorAmount,
				initiatorAddress, null, hashlock, secret, initiatorTimelock, acceptorTimelock,
				null, null, createdAt, null, null, null, null, null, null, null, null, null, createdAt, 0);
	}

	/** Constructs offer loaded from repository. */
	public SwapOfferData(String swapId, SwapStatus status,
			SupportedAsset initiatorAsset, BigDecimal initiatorAmount,
			SupportedAsset acceptorAsset, BigDecimal acceptorAmount,
			String initiatorAddress, String acceptorAddress,
			String hashlock, byte[] secret, long initiatorTimelock, long acceptorTimelock,
			String initiatorTxid, String acceptorTxid,
			long createdAt, Long acceptedAt, Long initiatorClaimedAt, Long completedAt,
			Long initiatorRefundedAt, Long acceptorRefundedAt,
			String lastFailure, Long lastFailureAt, String pendingAction, Long pendingSince,
			long updatedAt, int version) {
		this.swapId = swapId;
		this.status = status;
		this.initiatorAsset = initiatorAsset;
		this.initiatorAmount = initiatorAmount;
		this.acceptorAsset = acceptorAsset;
		this.acceptorAmount = acceptorAmount;
		this.initiatorAddress = initiatorAddress;
		this.acceptorAddress = acceptorAddress;
		this.hashlock = hashlock;
		this.secret = secret;
		this.initiatorTimelock = initiatorTimelock;
		this.acceptorTimelock = acceptorTimelock;
		this.initiatorTxid = initiatorTxid;
		this.acceptorTxid = acceptorTxid;
		this.createdAt = createdAt;
		this.acceptedAt = acceptedAt;
		this.initiatorClaimedAt = initiatorClaimedAt;
		this.completedAt = completedAt;
		this.initiatorRefundedAt = initiatorRefundedAt;
		this.acceptorRefundedAt = acceptorRefundedAt;
		this.lastFailure = lastFailure;
		this.lastFailureAt = lastFailureAt;
		this.pendingAction = pendingAction;
		this.pendingSince = pendingSince;
		this.updatedAt = updatedAt;
		this.version = version;
	}

	public String getSwapId() {
		return this.swapId;
	}

	public SwapStatus getStatus() {
		return this.status;
	}

	public void setStatus(SwapStatus status) {
		this.status = status;
	}

	public SupportedAsset getInitiatorAsset() {
		return this.initiatorAsset;
	}

	public BigDecimal getInitiatorAmount() {
		return this.initiatorAmount;
	}

	public SupportedAsset getAcceptorAsset() {
		return this.acceptorAsset;
	}

	public BigDecimal getAcceptorAmount() {
		return this.acceptorAmount;
	}

	public String getInitiatorAddress() {
		return this.initiatorAddress;
	}

	public String getAcceptorAddress() {
		return this.acceptorAddress;
	}

	public void setAcceptorAddress(String acceptorAddress) {
		this.acceptorAddress = acceptorAddress;
	}

	public String getHashlock() {
		return this.hashlock;
	}

	public byte[] getSecret() {
		return this.secret;
	}

	public long getInitiatorTimelock() {
		return this.initiatorTimelock;
	}

	public long getAcceptorTimelock() {
		return this.acceptorTimelock;
	}

	public String getInitiatorTxid() {
		return this.initiatorTxid;
	}

	public void setInitiatorTxid(String initiatorTxid) {
		this.initiatorTxid = initiatorTxid;
	}

	public String getAcceptorTxid() {
		return this.acceptorTxid;
	}

	public void setAcceptorTxid(String acceptorTxid) {
		this.acceptorTxid = acceptorTxid;
	}

	public long getCreatedAt() {
		return this.createdAt;
	}

	public Long getAcceptedAt() {
		return this.acceptedAt;
	}

	public void setAcceptedAt(Long acceptedAt) {
		this.acceptedAt = acceptedAt;
	}

	public Long getInitiatorClaimedAt() {
		return this.initiatorClaimedAt;
	}

	public void setInitiatorClaimedAt(Long initiatorClaimedAt) {
		this.initiatorClaimedAt = initiatorClaimedAt;
	}

	public Long getCompletedAt() {
		return this.completedAt;
	}

	public void setCompletedAt(Long completedAt) {
		this.completedAt = completedAt;
	}

	public Long getInitiatorRefundedAt() {
		return this.initiatorRefundedAt;
	}

	public void setInitiatorRefundedAt(Long initiatorRefundedAt) {
		this.initiatorRefundedAt = initiatorRefundedAt;
	}

	public Long getAcceptorRefundedAt() {
		return this.acceptorRefundedAt;
	}

	public void setAcceptorRefundedAt(Long acceptorRefundedAt) {
		this.acceptorRefundedAt = acceptorRefundedAt;
	}

	public String getLastFailure() {
		return this.lastFailure;
	}

	public Long getLastFailureAt() {
		return this.lastFailureAt;
	}

	public void setLastFailure(String lastFailure, Long lastFailureAt) {
		this.lastFailure = lastFailure;
		this.lastFailureAt = lastFailureAt;
	}

	public String getPendingAction() {
		return this.pendingAction;
	}

	public Long getPendingSince() {
		return this.pendingSince;
	}

	public void setPendingAction(String pendingAction, Long pendingSince) {
		this.pendingAction = pendingAction;
		this.pendingSince = pendingSince;
	}

	public long getUpdatedAt() {
		return this.updatedAt;
	}

	public void setUpdatedAt(long updatedAt) {
		this.updatedAt = updatedAt;
	}

	public int getVersion() {
		return this.version;
	}

	public void setVersion(int version) {
		this.version = version;
	}

	/** Returns true if initiator leg is locked and neither claimed by acceptor nor refunded. */
	public boolean hasOutstandingInitiatorLock() {
		return this.initiatorTxid != null && this.initiatorRefundedAt == null && this.completedAt == null;
	}

	/** Returns true if acceptor leg is locked and neither claimed by initiator nor refunded. */
	public boolean hasOutstandingAcceptorLock() {
		return this.acceptorTxid != null && this.acceptorRefundedAt == null && this.initiatorClaimedAt == null;
	}

	@Override
	public String toString() {
		return String.format("%s [%s: %s %s for %s %s]", this.swapId, this.status,
				this.initiatorAmount, this.initiatorAsset, this.acceptorAmount, this.acceptorAsset);
	}

}
