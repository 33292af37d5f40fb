package com.zephyrus.agent.client;

import com.zephyrus.agent.model.FunctionDirection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Talks to the blockchain gateway that holds the signing keys.
 * Read calls go to {@code /call-read-function}, writes to {@code /call-write-function}.
 */
@Slf4j
@Component
public class HttpContractCallClient implements ContractCallClient {

    private final RestTemplate restTemplate;
    private final String apiUrl;
    private final long defaultNetworkId;

    public HttpContractCallClient(RestTemplate restTemplate,
                                  @Value("${blockchain.api.url:http://localhost:3000}") String apiUrl,
                                  @Value("${blockchain.network-id:57054}") long defaultNetworkId) {
        this.restTemplate = restTemplate;
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.defaultNetworkId = defaultNetworkId;
    }

    @Override
    public CallResult call(ContractCall call) {
        boolean read = call.getDirection() == FunctionDirection.READ;
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("contractAddress", call.getContractAddress());
        body.put("functionName", call.getFunctionName());
        body.put("functionArgs", call.getArguments());
        body.put("abi", call.getAbi());
        body.put("networkId", call.getNetworkId() != null ? call.getNetworkId() : defaultNetworkId);
        if (!read) {
            if (call.getGasLimit() != null) {
                body.put("gasLimit", call.getGasLimit());
            }
            if (call.getMaxPriorityFee() != null) {
                body.put("maxPriorityFee", call.getMaxPriorityFee());
            }
        }

        String endpoint = apiUrl + (read ? "/call-read-function" : "/call-write-function");
        log.info("Calling {} function {} on contract {}", read ? "read" : "write",
            call.getFunctionName(), call.getContractAddress());

        Map<?, ?> response = post(endpoint, body, call.getFunctionName());
        if (response == null) {
            throw new CallTransportException("Empty response from " + endpoint, null);
        }
        if (read) {
            return CallResult.value(response.get("result"));
        }
        Object txHash = response.get("transactionHash");
        if (txHash == null) {
            throw new ContractRevertedException("Gateway returned no transaction hash for " + call.getFunctionName());
        }
        return CallResult.pending(txHash.toString());
    }

    private Map<?, ?> post(String endpoint, Map<String, Object> body, String functionName) {
        try {
            return restTemplate.postForObject(endpoint, body, Map.class);
        } catch (ResourceAccessException | HttpServerErrorException e) {
            throw new CallTransportException("Blockchain gateway unavailable: " + e.getMessage(), e);
        } catch (HttpClientErrorException e) {
            String detail = e.getResponseBodyAsString();
            if (isInterfaceRejection(detail)) {
                throw new InterfaceRejectedException(
                    "Gateway rejected interface of " + functionName + ": " + detail, e);
            }
            throw new ContractRevertedException("Call to " + functionName + " rejected: " + detail, e);
        }
    }

    static boolean isInterfaceRejection(String detail) {
        String lower = detail == null ? "" : detail.toLowerCase(Locale.ROOT);
        return lower.contains("invalid abi")
            || lower.contains("no matching function")
            || lower.contains("does not exist in contract abi");
    }
}
