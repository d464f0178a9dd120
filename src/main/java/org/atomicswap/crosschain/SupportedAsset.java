package org.atomicswap.crosschain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

public enum SupportedAsset {

	/** Base-layer asset. */
	BTC,

	/** Second-layer (Liquid sidechain) asset. */
	DEPIX;

	private static final Map<String, SupportedAsset> assetsByName = Arrays.stream(SupportedAsset.values())
			.collect(Collectors.toUnmodifiableMap(Enum::name, asset -> asset));

	/** Returns asset matching name, ignoring case, or null if unsupported. */
	public static SupportedAsset fromString(String name) {
		if (name == null)
			return null;

		return assetsByName.get(name.trim().toUpperCase(Locale.ROOT));
	}

}
