package com.zephyrus.agent.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class ContractDefinition {
    String contractId;
    String name;
    String address;
    List<Map<String, Object>> abi;
    Long networkId;
}
