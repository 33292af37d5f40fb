package com.zephyrus.agent.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Client-supplied agent configuration ({@code create_agent} payload).
 */
@Data
public class AgentSpec {
    @JsonAlias({"agentId"})
    private String agentId;
    private String name;
    private String description;
    private String owner;
    @JsonAlias({"contractId"})
    private String contractId;
    @JsonAlias({"contractAddress", "address"})
    private String contractAddress;
    private List<Map<String, Object>> abi;
    @JsonAlias({"networkId"})
    private Long networkId;
    @JsonAlias({"gasLimit"})
    private String gasLimit;
    @JsonAlias({"maxPriorityFee"})
    private String maxPriorityFee;
    @JsonAlias({"contractState"})
    private Map<String, Object> contractState;
    @JsonAlias({"connectionScoped"})
    private boolean connectionScoped;
}
