package org.atomicswap.repository.hsqldb;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.atomicswap.crosschain.SupportedAsset;
import org.atomicswap.data.swap.SwapOfferData;
import org.atomicswap.data.swap.SwapStatus;
import org.atomicswap.repository.DataException;
import org.atomicswap.repository.SwapRepository;

public class HSQLDBSwapRepository implements SwapRepository {

	private static final String SWAP_OFFER_COLUMNS = "swap_id, status, "
			+ "initiator_asset, initiator_amount, acceptor_asset, acceptor_amount, "
			+ "initiator_address, acceptor_address, hashlock, secret, "
			+ "initiator_timelock, acceptor_timelock, initiator_txid, acceptor_txid, "
			+ "created_at, accepted_at, initiator_claimed_at, completed_at, "
			+ "initiator_refunded_at, acceptor_refunded_at, last_failure, last_failure_at, "
			+ "pending_action, pending_since, updated_at, version";

	protected HSQLDBRepository repository;

	public HSQLDBSwapRepository(HSQLDBRepository repository) {
		this.repository = repository;
	}

	@Override
	public SwapOfferData fromSwapId(String swapId) throws DataException {
		String sql = "SELECT " + SWAP_OFFER_COLUMNS + " FROM SwapOffers WHERE swap_id = ?";

		try (ResultSet resultSet = this.repository.checkedExecute(sql, swapId)) {
			if (resultSet == null)
				return null;

			return swapOfferFromResultSet(resultSet);
		} catch (SQLException e) {
			throw new DataException("Unable to fetch swap offer from repository", e);
		}
	}

	@Override
	public List<SwapOfferData> getSwapOffers(SwapStatus status) throws DataException {
		StringBuilder sql = new StringBuilder(512);
		sql.append("SELECT ");
		sql.append(SWAP_OFFER_COLUMNS);
		sql.append(" FROM SwapOffers");

		List<Object> bindParams = new ArrayList<>();

		if (status != null) {
			sql.append(" WHERE status = ?");
			bindParams.add(status.name());
		}

		sql.append(" ORDER BY created_at DESC, swap_id");

		return this.fetchSwapOffers(sql.toString(), bindParams.toArray());
	}

	@Override
	public List<SwapOfferData> getSwapOffersByStatuses(Collection<SwapStatus> statuses) throws DataException {
		if (statuses == null || statuses.isEmpty())
			return new ArrayList<>();

		StringBuilder sql = new StringBuilder(512);
		sql.append("SELECT ");
		sql.append(SWAP_OFFER_COLUMNS);
		sql.append(" FROM SwapOffers WHERE status IN ");
		HSQLDBRepository.placeholdersSql(sql, statuses);
		sql.append(" ORDER BY created_at DESC, swap_id");

		Object[] bindParams = statuses.stream().map(SwapStatus::name).toArray();

		return this.fetchSwapOffers(sql.toString(), bindParams);
	}

	private List<SwapOfferData> fetchSwapOffers(String sql, Object... bindParams) throws DataException {
		List<SwapOfferData> swapOffers = new ArrayList<>();

		try (ResultSet resultSet = this.repository.checkedExecute(sql, bindParams)) {
			if (resultSet == null)
				return swapOffers;

			do {
				swapOffers.add(swapOfferFromResultSet(resultSet));
			} while (resultSet.next());

			return swapOffers;
		} catch (SQLException e) {
			throw new DataException("Unable to fetch swap offers from repository", e);
		}
	}

	@Override
	public void create(SwapOfferData swapOfferData) throws DataException {
		HSQLDBSaver saveHelper = new HSQLDBSaver("SwapOffers");

		saveHelper.bind("swap_id", swapOfferData.getSwapId())
				.bind("initiator_asset", swapOfferData.getInitiatorAsset().name())
				.bind("initiator_amount", swapOfferData.getInitiatorAmount())
				.bind("acceptor_asset", swapOfferData.getAcceptorAsset().name())
				.bind("acceptor_amount", swapOfferData.getAcceptorAmount())
				.bind("initiator_address", swapOfferData.getInitiatorAddress())
				.bind("hashlock", swapOfferData.getHashlock())
				.bind("secret", swapOfferData.getSecret())
				.bind("initiator_timelock", swapOfferData.getInitiatorTimelock())
				.bind("acceptor_timelock", swapOfferData.getAcceptorTimelock())
				.bind("created_at", swapOfferData.getCreatedAt());

		bindMutableColumns(saveHelper, swapOfferData).bind("version", swapOfferData.getVersion());

		try {
			saveHelper.insert(this.repository);
		} catch (SQLException e) {
			throw new DataException("Unable to save swap offer into repository", e);
		}
	}

	@Override
	public boolean update(SwapOfferData swapOfferData, SwapStatus expectedStatus, int expectedVersion) throws DataException {
		HSQLDBSaver saveHelper = new HSQLDBSaver("SwapOffers");

		int newVersion = expectedVersion + 1;
		bindMutableColumns(saveHelper, swapOfferData).bind("version", newVersion);

		try {
			int rowCount = saveHelper.update(this.repository, "swap_id = ? AND status = ? AND version = ?",
					swapOfferData.getSwapId(), expectedStatus.name(), expectedVersion);

			if (rowCount == 0)
				return false;

			swapOfferData.setVersion(newVersion);
			return true;
		} catch (SQLException e) {
			throw new DataException("Unable to update swap offer in repository", e);
		}
	}

	private static HSQLDBSaver bindMutableColumns(HSQLDBSaver saveHelper, SwapOfferData swapOfferData) {
		return saveHelper.bind("status", swapOfferData.getStatus().name())
				.bind("acceptor_address", swapOfferData.getAcceptorAddress())
				.bind("initiator_txid", swapOfferData.getInitiatorTxid())
				.bind("acceptor_txid", swapOfferData.getAcceptorTxid())
				.bind("accepted_at", swapOfferData.getAcceptedAt())
				.bind("initiator_claimed_at", swapOfferData.getInitiatorClaimedAt())
				.bind("completed_at", swapOfferData.getCompletedAt())
				.bind("initiator_refunded_at", swapOfferData.getInitiatorRefundedAt())
				.bind("acceptor_refunded_at", swapOfferData.getAcceptorRefundedAt())
				.bind("last_failure", swapOfferData.getLastFailure())
				.bind("last_failure_at", swapOfferData.getLastFailureAt())
				.bind("pending_action", swapOfferData.getPendingAction())
				.bind("pending_since", swapOfferData.getPendingSince())
				.bind("updated_at", swapOfferData.getUpdatedAt());
	}

	private static SwapOfferData swapOfferFromResultSet(ResultSet resultSet) throws SQLException, DataException {
		String swapId = resultSet.getString(1);

		SwapStatus status = SwapStatus.fromString(resultSet.getString(2));
		if (status == null)
			throw new DataException("Illegal swap status fetched from repository");

		SupportedAsset initiatorAsset = SupportedAsset.fromString(resultSet.getString(3));
		BigDecimal initiatorAmount = resultSet.getBigDecimal(4);
		SupportedAsset acceptorAsset = SupportedAsset.fromString(resultSet.getString(5));
		BigDecimal acceptorAmount = resultSet.getBigDecimal(6);
		if (initiatorAsset == null || acceptorAsset == null)
			throw new DataException("Unsupported swap asset fetched from repository");

		String initiatorAddress = resultSet.getString(7);
		String acceptorAddress = resultSet.getString(8);
		String hashlock = resultSet.getString(9);
		byte[] secret = resultSet.getBytes(10);
		long initiatorTimelock = resultSet.getLong(11);
		long acceptorTimelock = resultSet.getLong(12);
		String initiatorTxid = resultSet.getString(13);
		String acceptorTxid = resultSet.getString(14);
		long createdAt = resultSet.getLong(15);
		Long acceptedAt = getNullableLong(resultSet, 16);
		Long initiatorClaimedAt = getNullableLong(resultSet, 17);
		Long completedAt = getNullableLong(resultSet, 18);
		Long initiatorRefundedAt = getNullableLong(resultSet, 19);
		Long acceptorRefundedAt = getNullableLong(resultSet, 20);
		String lastFailure = resultSet.getString(21);
		Long lastFailureAt = getNullableLong(resultSet, 22);
		String pendingAction = resultSet.getString(23);
		Long pendingSince = getNullableLong(resultSet, 24);
		long updatedAt = resultSet.getLong(25);
		int version = resultSet.getInt(26);

		return new SwapOfferData(swapId, status, initiatorAsset, initiatorAmount, acceptorAsset, acceptorAmount,
				initiatorAddress, acceptorAddress, hashlock, secret, initiatorTimelock, acceptorTimelock,
				initiatorTxid, acceptorTxid, createdAt, acceptedAt, initiatorClaimedAt, completedAt,
				initiatorRefundedAt, acceptorRefundedAt, lastFailure, lastFailureAt, pendingAction, pendingSince,
				updatedAt, version);
	}

	private static Long getNullableLong(ResultSet resultSet, int columnIndex) throws SQLException {
		long value = resultSet.getLong(columnIndex);
		if (value == 0 && resultSet.wasNull())
			return null;

		return value;
	}

}
