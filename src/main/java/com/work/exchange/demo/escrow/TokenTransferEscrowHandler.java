package com.work.exchange.demo.escrow;

import com.work.exchange.core.escrow.EscrowCall;
import com.work.exchange.core.escrow.EscrowHandler;
import com.work.exchange.core.escrow.EscrowOutcome;
import com.work.exchange.core.model.OfferMembers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.Utils;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Hash;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

import static com.work.exchange.core.support.ValidationUtils.normalizeAddress;
import static com.work.exchange.core.support.ValidationUtils.requireNonNull;

/**
 * 示例 escrow：结算时把 token 从 consumer 转给 provider app 的 owner。
 *
 * 约定：
 * 1. selector 为 transact(bytes8,address,uint256) 的 method id
 * 2. args 为 ABI 编码的 (address token, uint256 amount)
 * 3. consumer 需事先对本 handler 地址 approve 足够额度
 *
 * 参与方通过 getOfferMembers 回查 orderbook（只读，不受重入保护影响）。
 */
public class TokenTransferEscrowHandler implements EscrowHandler {

    public static final String SIGNATURE = "transact(bytes8,address,uint256)";

    /** keccak256(SIGNATURE) 的前 4 字节。 */
    public static final String SELECTOR = Hash.sha3String(SIGNATURE).substring(0, 10);

    private static final Logger log = LoggerFactory.getLogger(TokenTransferEscrowHandler.class);

    private final String address;
    private final TokenLedger ledger;
    private final Function<String, OfferMembers> membersLookup;

    public TokenTransferEscrowHandler(String address, TokenLedger ledger, Function<String, OfferMembers> membersLookup) {
        this.address = normalizeAddress(address, "address");
        this.ledger = requireNonNull(ledger, "ledger");
        this.membersLookup = requireNonNull(membersLookup, "membersLookup");
    }

    public String getAddress() {
        return address;
    }

    /**
     * 构造 prepare 时需要的 escrow args。
     */
    public static String encodeArgs(String token, BigInteger amount) {
        return "0x" + FunctionEncoder.encodeConstructor(Arrays.<Type>asList(new Address(token), new Uint256(amount)));
    }

    @Override
    public EscrowOutcome attempt(EscrowCall call) {
        if (!SELECTOR.equalsIgnoreCase(call.getSelector())) {
            return EscrowOutcome.failure("unknown selector " + call.getSelector().toLowerCase(Locale.ROOT));
        }
        List<Type> decoded = FunctionReturnDecoder.decode(call.getArgs(), Utils.convert(Arrays.<TypeReference<?>>asList(
                new TypeReference<Address>() {
                },
                new TypeReference<Uint256>() {
                })));
        if (decoded.size() != 2) {
            return EscrowOutcome.failure("malformed escrow args");
        }
        String token = ((Address) decoded.get(0)).getValue();
        BigInteger amount = ((Uint256) decoded.get(1)).getValue();

        OfferMembers members = membersLookup.apply(call.getOfferId());
        // 余额/额度不足时抛 IllegalStateException，由 EscrowInvoker 转为失败结果
        ledger.transferFrom(token, address, members.getConsumer(), members.getProviderOwner(), amount);
        log.info("escrow transfer done offerId={} token={} from={} to={} amount={}",
                call.getOfferId(), token, members.getConsumer(), members.getProviderOwner(), amount);

        return EscrowOutcome.success("0x" + FunctionEncoder.encodeConstructor(Arrays.<Type>asList(
                new Address(token),
                new Address(members.getConsumer()),
                new Address(members.getProviderOwner()),
                new Uint256(amount))));
    }
}
