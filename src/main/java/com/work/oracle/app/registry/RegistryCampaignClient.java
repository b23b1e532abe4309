package com.work.oracle.app.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.work.oracle.app.config.RegistryProperties;
import com.work.oracle.app.registry.dto.CampaignUpdateRequest;
import com.work.oracle.core.chain.CampaignSource;
import com.work.oracle.core.chain.CampaignStatusNotifier;
import com.work.oracle.core.exception.SourceUnavailableException;
import com.work.oracle.core.model.CampaignId;
import com.work.oracle.core.model.CampaignIdType;
import com.work.oracle.core.model.CampaignStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;

import static com.work.oracle.core.support.ValidationUtils.requireNonNull;

/**
 * 外部 campaign 登记处的 HTTP 客户端：
 * - GET /get-all-campaigns 作为 campaign 来源，响应体为 {"result": [...]}
 * - POST /update-campaign 回写结算后的状态（仅 discard，且 notify-discards=true）
 *
 * 任何网络错误、非 2xx、缺失或非法的 result 都视为来源不可用，绝不退化为空列表。
 */
public class RegistryCampaignClient implements CampaignSource, CampaignStatusNotifier {

    private static final Logger log = LoggerFactory.getLogger(RegistryCampaignClient.class);

    static final String LIST_PATH = "/get-all-campaigns";
    static final String UPDATE_PATH = "/update-campaign";

    private final RestTemplate restTemplate;
    private final CampaignIdType idType;
    private final boolean notifyDiscards;

    public RegistryCampaignClient(RestTemplate restTemplate, CampaignIdType idType, boolean notifyDiscards) {
        this.restTemplate = requireNonNull(restTemplate, "restTemplate");
        this.idType = requireNonNull(idType, "idType");
        this.notifyDiscards = notifyDiscards;
    }

    /**
     * 按登记处配置构造 RestTemplate：根地址、鉴权头与超时。
     */
    public static RestTemplate buildRestTemplate(RestTemplateBuilder builder, RegistryProperties props) {
        return builder
                .rootUri(props.getBaseUrl())
                .defaultHeader("x-api-key", props.getApiKey())
                .defaultHeader("source", props.getSource())
                .setConnectTimeout(props.getConnectTimeout())
                .setReadTimeout(props.getReadTimeout())
                .build();
    }

    @Override
    public List<CampaignId> listCampaignIds() {
        JsonNode body;
        try {
            body = restTemplate.getForObject(LIST_PATH, JsonNode.class);
        } catch (RestClientException e) {
            throw new SourceUnavailableException("registry " + LIST_PATH + " failed: " + e.getMessage(), e);
        }
        if (body == null) {
            throw new SourceUnavailableException("registry " + LIST_PATH + " returned empty body");
        }
        JsonNode result = body.get("result");
        if (result == null || !result.isArray()) {
            throw new SourceUnavailableException("registry " + LIST_PATH + " response has no 'result' array");
        }

        List<CampaignId> ids = new ArrayList<>(result.size());
        for (JsonNode item : result) {
            if (!item.isTextual() && !item.isIntegralNumber()) {
                throw new SourceUnavailableException("registry returned non-scalar campaign id: " + item);
            }
            try {
                ids.add(CampaignId.parse(item.asText(), idType));
            } catch (IllegalArgumentException e) {
                throw new SourceUnavailableException("registry returned invalid campaign id: " + item, e);
            }
        }
        log.debug("Registry campaigns listed. count={}", ids.size());
        return ids;
    }

    @Override
    public void campaignSettled(CampaignId campaignId, CampaignStatus status) {
        if (!notifyDiscards || status != CampaignStatus.DISCARDED) {
            return;
        }
        restTemplate.postForEntity(UPDATE_PATH, new CampaignUpdateRequest(campaignId.toString(), status.name()), Void.class);
        log.info("Registry campaign status updated. campaignId={} status={}", campaignId, status);
    }
}
