package org.atomicswap.api.resource;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.tags.Tag;

@OpenAPIDefinition(
		info = @Info( title = "Atomic swap API", description = "Coordinates hash time-locked swaps between BTC and DePix" ),
		tags = {
			@Tag(name = "Atomic swaps")
		}
)
public class ApiDefinition {
}
