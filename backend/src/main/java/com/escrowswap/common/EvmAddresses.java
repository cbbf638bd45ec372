package com.escrowswap.common;

import java.util.regex.Pattern;

/**
 * EVM address format check (0x + 40 hex, checksum not verified).
 */
public final class EvmAddresses {

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");

    private EvmAddresses() {
    }

    public static boolean isValid(String address) {
        return address != null && EVM_ADDRESS.matcher(address.trim()).matches();
    }
}
