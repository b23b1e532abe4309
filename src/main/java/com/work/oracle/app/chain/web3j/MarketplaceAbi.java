package com.work.oracle.app.chain.web3j;

import com.work.oracle.core.model.Campaign;
import com.work.oracle.core.model.CampaignId;
import com.work.oracle.core.model.CampaignIdType;
import com.work.oracle.core.model.CampaignStatus;
import com.work.oracle.core.model.CallKind;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * marketplace 合约与 ERC-20 代币的 ABI 编解码。
 * <p>
 * getCampaignInfo 返回元组：(bytes32 metadata, uint256 reserved, address creator, address kol,
 * uint256 offerEndsIn, uint256 promotionEndsIn, uint256 amount, uint8 status)，前两个字段不参与结算。
 */
public final class MarketplaceAbi {

    static final int CAMPAIGN_INFO_FIELDS = 8;

    private MarketplaceAbi() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static String encodeGetCampaignInfo(CampaignId id) {
        return FunctionEncoder.encode(getCampaignInfo(id));
    }

    @SuppressWarnings("rawtypes")
    public static Function getCampaignInfo(CampaignId id) {
        List<TypeReference<?>> outputs = Arrays.asList(
                new TypeReference<Bytes32>() { },
                new TypeReference<Uint256>() { },
                new TypeReference<Address>() { },
                new TypeReference<Address>() { },
                new TypeReference<Uint256>() { },
                new TypeReference<Uint256>() { },
                new TypeReference<Uint256>() { },
                new TypeReference<Uint8>() { });
        return new Function("getCampaignInfo", Collections.<Type>singletonList(idParam(id)), outputs);
    }

    public static String encodeGetAllCampaigns(CampaignIdType idType) {
        return FunctionEncoder.encode(getAllCampaigns(idType));
    }

    public static Function getAllCampaigns(CampaignIdType idType) {
        TypeReference<?> output = idType == CampaignIdType.BYTES32
                ? new TypeReference<DynamicArray<Bytes32>>() { }
                : new TypeReference<DynamicArray<Uint256>>() { };
        return new Function("getAllCampaigns", Collections.<Type>emptyList(), Collections.singletonList(output));
    }

    public static String encodeTransition(CallKind kind, CampaignId id) {
        if (!kind.isMarketplaceCall()) {
            throw new IllegalArgumentException(kind + " 不是 marketplace 调用");
        }
        Function fn = new Function(kind.getFunctionName(),
                Collections.<Type>singletonList(idParam(id)), Collections.<TypeReference<?>>emptyList());
        return FunctionEncoder.encode(fn);
    }

    public static String encodeTransfer(String recipient, BigInteger amount) {
        Function fn = new Function(CallKind.TRANSFER.getFunctionName(),
                Arrays.<Type>asList(new Address(recipient), new Uint256(amount)),
                Collections.<TypeReference<?>>singletonList(new TypeReference<Bool>() { }));
        return FunctionEncoder.encode(fn);
    }

    /**
     * 解码 getCampaignInfo 的返回数据。状态码超出枚举范围时抛 IllegalArgumentException。
     */
    public static Campaign decodeCampaign(CampaignId id, String returnData) {
        @SuppressWarnings("rawtypes")
        List<Type> values = FunctionReturnDecoder.decode(returnData, getCampaignInfo(id).getOutputParameters());
        if (values.size() != CAMPAIGN_INFO_FIELDS) {
            throw new IllegalArgumentException("getCampaignInfo 返回字段数异常: " + values.size());
        }
        String creator = ((Address) values.get(2)).getValue();
        String kol = ((Address) values.get(3)).getValue();
        BigInteger offerEndsIn = ((Uint256) values.get(4)).getValue();
        BigInteger promotionEndsIn = ((Uint256) values.get(5)).getValue();
        BigInteger amount = ((Uint256) values.get(6)).getValue();
        int statusCode = ((Uint8) values.get(7)).getValue().intValueExact();
        return new Campaign(id, creator, kol, offerEndsIn, promotionEndsIn, amount, CampaignStatus.fromOrdinal(statusCode));
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    public static List<CampaignId> decodeCampaignIds(CampaignIdType idType, String returnData) {
        List<Type> values = FunctionReturnDecoder.decode(returnData, getAllCampaigns(idType).getOutputParameters());
        if (values.isEmpty()) {
            throw new IllegalArgumentException("getAllCampaigns 返回为空");
        }
        List<Type> items = ((DynamicArray<Type>) values.get(0)).getValue();
        List<CampaignId> ids = new ArrayList<>(items.size());
        for (Type item : items) {
            if (idType == CampaignIdType.BYTES32) {
                ids.add(CampaignId.ofBytes32(((Bytes32) item).getValue()));
            } else {
                ids.add(CampaignId.ofUint(((Uint256) item).getValue()));
            }
        }
        return ids;
    }

    private static Type<?> idParam(CampaignId id) {
        if (id.getType() == CampaignIdType.BYTES32) {
            return new Bytes32(id.toBytes());
        }
        return new Uint256(id.toUint());
    }
}
