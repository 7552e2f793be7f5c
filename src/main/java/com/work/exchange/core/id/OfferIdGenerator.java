package com.work.exchange.core.id;

import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.util.Arrays;

import static com.work.exchange.core.support.ValidationUtils.normalizeAddress;
import static com.work.exchange.core.support.ValidationUtils.requireNonNegative;

/**
 * 8 字节句柄生成器：keccak256(creator(20) ‖ uint256(clock) ‖ uint256(distinguishing)) 取前 8 字节。
 * <p>纯函数，同样的输入永远得到同样的句柄；唯一性由调用方在冲突时递增 distinguishing 值保证。</p>
 */
public class OfferIdGenerator {

    public static final int ID_LENGTH = 8;
    private static final int WORD = 32;

    public String generate(String creator, long clock, long distinguishing) {
        requireNonNegative(clock, "clock");
        requireNonNegative(distinguishing, "distinguishing");
        byte[] address = Numeric.hexStringToByteArray(normalizeAddress(creator, "creator"));

        ByteBuffer buf = ByteBuffer.allocate(address.length + WORD * 2);
        buf.put(address);
        buf.put(Numeric.toBytesPadded(BigInteger.valueOf(clock), WORD));
        buf.put(Numeric.toBytesPadded(BigInteger.valueOf(distinguishing), WORD));

        byte[] hash = Hash.sha3(buf.array());
        return Numeric.toHexString(Arrays.copyOf(hash, ID_LENGTH));
    }
}
