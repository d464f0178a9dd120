package org.atomicswap.utils;

import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public class NamedThreadFactory implements ThreadFactory {

	private final String name;
	private final boolean daemon;
	private final AtomicInteger threadNumber = new AtomicInteger(1);

	public NamedThreadFactory(String name) {
		this(name, false);
	}

	public NamedThreadFactory(String name, boolean daemon) {
		this.name = name;
		this.daemon = daemon;
	}

	@Override
	public Thread newThread(Runnable runnable) {
		Thread thread = Executors.defaultThreadFactory().newThread(runnable);
		thread.setName(this.name + "-" + this.threadNumber.getAndIncrement());
		thread.setDaemon(this.daemon);

		return thread;
	}

}
