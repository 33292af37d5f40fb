package com.zephyrus.agent.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * {@code create_contract} payload.
 */
@Data
public class ContractSpec {
    private String name;
    @JsonAlias({"contractAddress", "contract_address"})
    private String address;
    private List<Map<String, Object>> abi;
    @JsonAlias({"networkId"})
    private Long networkId;
}
