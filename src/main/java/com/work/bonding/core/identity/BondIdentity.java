package com.work.bonding.core.identity;

import com.work.bonding.core.model.BondId;
import com.work.bonding.core.model.BondIntent;
import org.web3j.abi.TypeEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import static com.work.bonding.core.support.ValidationUtils.requireAddress;
import static com.work.bonding.core.support.ValidationUtils.requireNonNull;

/**
 * BondId 推导：
 * <pre>
 *     keccak256(abi.encode(address instance, address owner, uint256 amount, bytes32 poolId, uint256 nonce))
 * </pre>
 * 编码与链上合约保持逐位一致，链下算出的 id 可以直接和链上事件对账。
 */
public final class BondIdentity {

    private final String instanceAddress;

    public BondIdentity(String instanceAddress) {
        this.instanceAddress = requireAddress(instanceAddress, "instanceAddress");
    }

    public BondId derive(String owner, BondIntent intent) {
        String normalizedOwner = requireAddress(owner, "owner");
        requireNonNull(intent, "intent");
        String encoded = TypeEncoder.encode(new Address(instanceAddress))
                + TypeEncoder.encode(new Address(normalizedOwner))
                + TypeEncoder.encode(new Uint256(intent.getAmount()))
                + TypeEncoder.encode(new Bytes32(intent.getPoolId().toBytes()))
                + TypeEncoder.encode(new Uint256(intent.getNonce()));
        return BondId.of(Hash.sha3(Numeric.hexStringToByteArray(encoded)));
    }

    public String getInstanceAddress() {
        return instanceAddress;
    }
}
