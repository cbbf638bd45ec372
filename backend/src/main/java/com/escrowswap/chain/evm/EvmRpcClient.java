package com.escrowswap.chain.evm;

import reactor.core.publisher.Mono;

/**
 * EVM JSON-RPC transport. Retries and endpoint rotation are handled by {@link EvmChainClient}.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_getBalance"
     * @param params      positional params
     * @return raw JSON response body; errors with RpcException on HTTP failure
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
