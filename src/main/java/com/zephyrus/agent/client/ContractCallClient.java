package com.zephyrus.agent.client;

/**
 * Submits one contract call to the chain.
 *
 * @see CallTransportException
 * @see ContractRevertedException
 */
public interface ContractCallClient {

    CallResult call(ContractCall call);
}
