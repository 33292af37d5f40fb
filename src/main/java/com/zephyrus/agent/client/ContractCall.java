package com.zephyrus.agent.client;

import com.zephyrus.agent.model.FunctionDirection;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class ContractCall {
    String contractAddress;
    List<Map<String, Object>> abi;
    Long networkId;
    String functionName;
    /** Arguments in declaration order. */
    List<Object> arguments;
    FunctionDirection direction;
    String gasLimit;
    String maxPriorityFee;
}
