package com.work.exchange.core.account;

import com.work.exchange.core.clock.LedgerClock;
import com.work.exchange.core.exception.RegistryException;
import com.work.exchange.core.exception.UnauthorizedException;
import com.work.exchange.core.id.OfferIdGenerator;
import com.work.exchange.core.model.Account;
import com.work.exchange.core.repository.AccountStore;
import com.work.exchange.core.support.InMemoryAccountStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

import static com.work.exchange.core.support.ValidationUtils.isHex;
import static com.work.exchange.core.support.ValidationUtils.isHexOfLength;
import static com.work.exchange.core.support.ValidationUtils.normalizeAddress;
import static com.work.exchange.core.support.ValidationUtils.requireNonNull;

/**
 * 身份 → 账户的注册表，与 orderbook 平级，orderbook 不直接调用它。
 *
 * 两类账户：
 * 1. 普通账户：调用方地址即 owner，每个地址最多一个
 * 2. 临时账户：controller 以身份哈希（如手机号/邮箱的 keccak256）代为开户，
 *    真实用户之后拿原文 + 自己的签名调用 unlockTemporary 认领
 */
public class AccountRegistry {

    private static final Logger log = LoggerFactory.getLogger(AccountRegistry.class);

    private static final int HASH_LENGTH = 32;
    private static final int SIGNATURE_LENGTH = 65;

    private final OfferIdGenerator idGenerator;
    private final LedgerClock clock;
    private final AccountStore store;

    public AccountRegistry(OfferIdGenerator idGenerator, LedgerClock clock) {
        this(idGenerator, clock, new InMemoryAccountStore());
    }

    public AccountRegistry(OfferIdGenerator idGenerator, LedgerClock clock, AccountStore store) {
        this.idGenerator = requireNonNull(idGenerator, "idGenerator");
        this.clock = requireNonNull(clock, "clock");
        this.store = requireNonNull(store, "store");
    }

    public synchronized String create(String caller) {
        String owner = normalizeAddress(caller, "caller");
        if (store.findIdByOwner(owner).isPresent()) {
            throw new RegistryException(RegistryException.ACCOUNT_ALREADY_EXISTS);
        }
        String accountId = freshAccountId(owner);
        if (!store.insert(Account.permanent(accountId, owner))) {
            throw new RegistryException(RegistryException.ACCOUNT_ALREADY_EXISTS);
        }
        log.info("account created accountId={} owner={}", accountId, owner);
        return accountId;
    }

    /**
     * controller 以身份哈希开临时账户，调用方即 controller。
     */
    public synchronized String createTemporary(String caller, String identityHash) {
        String controller = normalizeAddress(caller, "caller");
        if (!isHexOfLength(identityHash, HASH_LENGTH)) {
            throw new IllegalArgumentException("identityHash 必须是 32 字节十六进制串");
        }
        String hash = identityHash.toLowerCase(Locale.ROOT);
        if (store.findIdByIdentityHash(hash).isPresent()) {
            throw new RegistryException(RegistryException.ACCOUNT_ALREADY_EXISTS);
        }
        String accountId = freshAccountId(controller);
        if (!store.insert(Account.temporary(accountId, hash, controller))) {
            throw new RegistryException(RegistryException.ACCOUNT_ALREADY_EXISTS);
        }
        log.info("temporary account created accountId={} controller={}", accountId, controller);
        return accountId;
    }

    /**
     * controller 协助认领临时账户。
     *
     * @param identityPreimage  身份原文（0x 十六进制），keccak256 后必须等于开户时的身份哈希
     * @param newOwner          认领人地址
     * @param passwordSignature 认领人对 keccak256(identityPreimage ‖ newOwner) 的 65 字节签名
     */
    public synchronized void unlockTemporary(String caller,
                                             String identityPreimage,
                                             String newOwner,
                                             String passwordSignature) {
        String controller = normalizeAddress(caller, "caller");
        String owner = normalizeAddress(newOwner, "newOwner");
        if (!isHex(identityPreimage)) {
            throw new IllegalArgumentException("identityPreimage 必须是 0x 开头的十六进制串");
        }
        byte[] preimage = Numeric.hexStringToByteArray(identityPreimage);
        String identityHash = Numeric.toHexString(Hash.sha3(preimage));

        Optional<Account> found = store.findIdByIdentityHash(identityHash).flatMap(store::find);
        if (!found.isPresent()) {
            throw new RegistryException(RegistryException.IDENTITY_MISMATCH);
        }
        Account account = found.get();
        String accountId = account.getAccountId();
        if (!account.isTemporary()) {
            throw new RegistryException(RegistryException.NOT_TEMPORARY);
        }
        if (!controller.equals(account.getController())) {
            throw new UnauthorizedException();
        }

        byte[] message = Hash.sha3(concat(preimage, Numeric.hexStringToByteArray(owner)));
        if (!owner.equals(recover(message, passwordSignature))) {
            throw new RegistryException(RegistryException.INVALID_SIGNATURE);
        }
        if (store.findIdByOwner(owner).isPresent() || !store.unlock(accountId, owner)) {
            throw new RegistryException(RegistryException.ACCOUNT_ALREADY_EXISTS);
        }
        log.info("temporary account unlocked accountId={} owner={}", accountId, owner);
    }

    /**
     * 从签名恢复签名者地址，返回其账户。
     */
    public synchronized String getAccountIdFromSignature(String messageHash, String signature) {
        if (!isHexOfLength(messageHash, HASH_LENGTH)) {
            throw new IllegalArgumentException("messageHash 必须是 32 字节十六进制串");
        }
        String signer = recover(Numeric.hexStringToByteArray(messageHash), signature);
        return store.findIdByOwner(signer)
                .orElseThrow(() -> new RegistryException(RegistryException.ACCOUNT_NOT_FOUND));
    }

    public synchronized Optional<Account> find(String accountId) {
        if (accountId == null) {
            return Optional.empty();
        }
        return store.find(accountId.toLowerCase(Locale.ROOT));
    }

    private String freshAccountId(String creator) {
        long now = clock.now();
        long distinguishing = 0L;
        String accountId = idGenerator.generate(creator, now, distinguishing);
        while (store.exists(accountId)) {
            distinguishing++;
            accountId = idGenerator.generate(creator, now, distinguishing);
        }
        return accountId;
    }

    /**
     * 65 字节 r ‖ s ‖ v 签名恢复出的小写地址；v 兼容 0/1 与 27/28 两种写法。
     */
    static String recover(byte[] messageHash, String signature) {
        if (!isHexOfLength(signature, SIGNATURE_LENGTH)) {
            throw new RegistryException(RegistryException.INVALID_SIGNATURE);
        }
        byte[] sig = Numeric.hexStringToByteArray(signature);
        byte v = sig[64];
        if (v < 27) {
            v += 27;
        }
        Sign.SignatureData data = new Sign.SignatureData(
                v, Arrays.copyOfRange(sig, 0, 32), Arrays.copyOfRange(sig, 32, 64));
        try {
            BigInteger publicKey = Sign.signedMessageHashToKey(messageHash, data);
            return Numeric.prependHexPrefix(Keys.getAddress(publicKey)).toLowerCase(Locale.ROOT);
        } catch (SignatureException | IllegalArgumentException e) {
            throw new RegistryException(RegistryException.INVALID_SIGNATURE, e);
        }
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] out = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }
}
