package org.atomicswap.repository;

public interface Repository extends AutoCloseable {

	public SwapRepository getSwapRepository();

	public void saveChanges() throws DataException;

	public void discardChanges() throws DataException;

	@Override
	public void close() throws DataException;

	public boolean getDebug();

	public void setDebug(boolean debugState);

}
