package org.atomicswap.api.resource;

import javax.ws.rs.GET;
import javax.ws.rs.Path;
import javax.ws.rs.Produces;
import javax.ws.rs.core.MediaType;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.atomicswap.api.model.HealthStatus;
import org.atomicswap.controller.Controller;
import org.atomicswap.repository.DataException;
import org.atomicswap.repository.Repository;
import org.atomicswap.repository.RepositoryManager;
import org.atomicswap.utils.NTP;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;

@Path("/health")
@Tag(name = "Health")
public class HealthResource {

	private static final Logger LOGGER = LogManager.getLogger(HealthResource.class);

	@GET
	@Produces(MediaType.APPLICATION_JSON)
	@Operation(
		summary = "Service health",
		description = "Always answers while the API is up. Status is degraded if swaps cannot currently progress.",
		responses = {
			@ApiResponse(
				content = @Content(mediaType = MediaType.APPLICATION_JSON, schema = @Schema(implementation = HealthStatus.class))
			)
		}
	)
	public HealthStatus getHealth() {
		boolean ntpSynchronized = NTP.getTime() != null;

		boolean repositoryAvailable;
		try (final Repository repository = RepositoryManager.getRepository()) {
			repositoryAvailable = true;
		} catch (DataException e) {
			LOGGER.warn(String.format("Repository unavailable for health check: %s", e.getMessage()));
			repositoryAvailable = false;
		}

		return new HealthStatus(Controller.getInstance().getVersionString(), ntpSynchronized, repositoryAvailable);
	}

}
