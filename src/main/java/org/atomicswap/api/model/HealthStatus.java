package org.atomicswap.api.model;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

import io.swagger.v3.oas.annotations.media.Schema;

@XmlAccessorType(XmlAccessType.FIELD)
public class HealthStatus {

	public static final String HEALTHY = "healthy";
	public static final String DEGRADED = "degraded";

	@Schema(description = "\"healthy\", or \"degraded\" if network time or repository is unavailable")
	public String status;

	public String version;

	public boolean ntpSynchronized;

	public boolean repositoryAvailable;

	protected HealthStatus() {
		/* JAXB */
	}

	public HealthStatus(String version, boolean ntpSynchronized, boolean repositoryAvailable) {
		this.status = ntpSynchronized && repositoryAvailable ? HEALTHY : DEGRADED;
		this.version = version;
		this.ntpSynchronized = ntpSynchronized;
		this.repositoryAvailable = repositoryAvailable;
	}

}
