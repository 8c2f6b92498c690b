package tech.yump.secretmanager.secrets.vault.transport;

import java.util.function.Supplier;

/**
 * Builds the transport of one manager instance.
 */
@FunctionalInterface
public interface VaultTransportFactory {

    /**
     * @param address       Vault base address without trailing slash.
     * @param tokenSupplier current session token; may return null before login.
     */
    VaultTransport create(String address, Supplier<String> tokenSupplier);
}
