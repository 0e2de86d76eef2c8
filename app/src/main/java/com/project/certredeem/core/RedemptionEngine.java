package com.project.certredeem.core;

import com.project.certredeem.crypto.AccountAddress;
import com.project.certredeem.crypto.CertificateId;
import com.project.certredeem.crypto.ErrorLogger;
import com.project.certredeem.crypto.IdentityHasher;
import com.project.certredeem.crypto.SignatureVerificationException;
import com.project.certredeem.crypto.SignatureVerifier;
import com.project.certredeem.events.RedemptionEvent;
import com.project.certredeem.events.RedemptionListener;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * Single and condensed redemption flows.
 *
 * <p>Both flows follow the same order: rebuild the signed hash, recover the signer, check it
 * against the relevant trust set, take the claim(s), then credit. Claims are taken before
 * the credit call, so a credit ledger that calls back into the engine sees them as already
 * claimed. If the credit call throws, the claims taken by this call are released before the
 * exception propagates.</p>
 *
 * <p>Events are emitted once the redemption is complete. A listener that throws is logged and
 * does not turn a completed redemption into a failure.</p>
 */
public class RedemptionEngine {

    private final CertificateRegistry registry;
    private final CondenserDelegateRegistry condensers;
    private final ClaimLedger claimLedger;
    private final CreditLedger creditLedger;
    private final SignatureVerifier verifier;
    private final CondensedAmountPolicy condensedAmountPolicy;
    private final RedemptionListener listener;

    public RedemptionEngine(CertificateRegistry registry,
                            CondenserDelegateRegistry condensers,
                            ClaimLedger claimLedger,
                            CreditLedger creditLedger,
                            SignatureVerifier verifier,
                            CondensedAmountPolicy condensedAmountPolicy,
                            RedemptionListener listener) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.condensers = Objects.requireNonNull(condensers, "condensers must not be null");
        this.claimLedger = Objects.requireNonNull(claimLedger, "claimLedger must not be null");
        this.creditLedger = Objects.requireNonNull(creditLedger, "creditLedger must not be null");
        this.verifier = Objects.requireNonNull(verifier, "verifier must not be null");
        this.condensedAmountPolicy = Objects.requireNonNull(condensedAmountPolicy, "condensedAmountPolicy must not be null");
        this.listener = RedemptionListener.compose(List.of(Objects.requireNonNull(listener, "listener must not be null")));
    }

    public RedemptionReceipt redeem(AccountAddress caller, String signatureHex, CertificateId certificateId) {
        return redeem(caller, decodeSignature("RedemptionEngine.redeem", signatureHex), certificateId);
    }

    /**
     * Redeem one certificate for {@code caller} with a delegate's signature over
     * {@code keccak256(certificateId || service || caller)}.
     */
    public RedemptionReceipt redeem(AccountAddress caller, byte[] signature, CertificateId certificateId) {
        Objects.requireNonNull(caller, "caller must not be null");
        Objects.requireNonNull(certificateId, "certificateId must not be null");

        byte[] redemptionHash = IdentityHasher.computeRedemptionHash(certificateId, registry.service(), caller);
        AccountAddress signer = recover("RedemptionEngine.redeem", redemptionHash, signature);
        if (!registry.isDelegate(certificateId, signer)) {
            ErrorLogger.logWarn("RedemptionEngine.redeem",
                String.format("Signer %s is not a delegate of %s", signer, certificateId));
            throw new RedemptionException(RedemptionException.Kind.UNAUTHORIZED,
                "Signer " + signer + " is not a delegate of certificate " + certificateId);
        }

        List<CertificateId> ids = List.of(certificateId);
        claimLedger.claim(certificateId, caller);
        BigInteger amount = registry.getCertificateAmount(certificateId);
        creditOrRelease("RedemptionEngine.redeem", ids, caller, amount);

        ErrorLogger.logInfo("RedemptionEngine.redeem",
            String.format("%s redeemed %s for %s (signer %s)", caller, certificateId, amount, signer));
        listener.onEvent(new RedemptionEvent.Redeemed(caller, amount, certificateId));
        return new RedemptionReceipt(caller, signer, amount, ids, false);
    }

    public RedemptionReceipt redeemCondensed(AccountAddress caller,
                                             String signatureHex,
                                             BigInteger combinedAmount,
                                             List<CertificateId> certificateIds) {
        return redeemCondensed(caller, decodeSignature("RedemptionEngine.redeemCondensed", signatureHex),
            combinedAmount, certificateIds);
    }

    /**
     * Redeem every listed certificate at once with a condenser's signature over
     * {@code keccak256(keccak256(ids) || combinedAmount || caller || service)}.
     * All ids are claimed or none is. Under {@link CondensedAmountPolicy#RECOMPUTED} the list
     * must not repeat an id; under {@link CondensedAmountPolicy#ATTESTED} a repeated id is
     * claimed once.
     */
    public RedemptionReceipt redeemCondensed(AccountAddress caller,
                                             byte[] signature,
                                             BigInteger combinedAmount,
                                             List<CertificateId> certificateIds) {
        Objects.requireNonNull(caller, "caller must not be null");
        InputValidator.validateAmount(combinedAmount, "combinedAmount");
        InputValidator.validateCertificateIds(certificateIds);
        if (condensedAmountPolicy == CondensedAmountPolicy.RECOMPUTED) {
            InputValidator.validateDistinct(certificateIds);
        }
        List<CertificateId> ids = List.copyOf(certificateIds);

        byte[] idsHash = IdentityHasher.computeCondensedIDsHash(ids);
        byte[] redemptionHash = IdentityHasher.computeCondensedRedemptionHash(
            idsHash, combinedAmount, caller, registry.service());
        AccountAddress signer = recover("RedemptionEngine.redeemCondensed", redemptionHash, signature);
        if (!condensers.isCondenserDelegate(signer)) {
            ErrorLogger.logWarn("RedemptionEngine.redeemCondensed",
                String.format("Signer %s is not a condenser delegate", signer));
            throw new RedemptionException(RedemptionException.Kind.UNAUTHORIZED,
                "Signer " + signer + " is not a condenser delegate");
        }
        if (condensedAmountPolicy == CondensedAmountPolicy.RECOMPUTED) {
            BigInteger registered = ids.stream()
                    .map(registry::getCertificateAmount)
                    .reduce(BigInteger.ZERO, BigInteger::add);
            if (!registered.equals(combinedAmount)) {
                ErrorLogger.logWarn("RedemptionEngine.redeemCondensed",
                    String.format("Attested amount %s differs from registered sum %s", combinedAmount, registered));
                throw new RedemptionException(RedemptionException.Kind.AMOUNT_MISMATCH,
                    String.format("Combined amount %s does not match registered sum %s", combinedAmount, registered));
            }
        }

        claimLedger.claimAll(ids, caller);
        creditOrRelease("RedemptionEngine.redeemCondensed", ids, caller, combinedAmount);

        ErrorLogger.logInfo("RedemptionEngine.redeemCondensed",
            String.format("%s redeemed %d certificates for %s (condenser %s)", caller, ids.size(), combinedAmount, signer));
        listener.onEvent(new RedemptionEvent.CondensedRedeemed(caller, combinedAmount, ids));
        return new RedemptionReceipt(caller, signer, combinedAmount, ids, true);
    }

    public CondensedAmountPolicy condensedAmountPolicy() {
        return condensedAmountPolicy;
    }

    private AccountAddress recover(String operation, byte[] messageHash, byte[] signature) {
        try {
            return verifier.recoverSigner(messageHash, signature);
        } catch (SignatureVerificationException e) {
            ErrorLogger.logWarn(operation, "Rejected signature: " + e.getMessage());
            RedemptionException.Kind kind = e.reason() == SignatureVerificationException.Reason.INVALID_FORMAT
                    ? RedemptionException.Kind.INVALID_SIGNATURE_FORMAT
                    : RedemptionException.Kind.SIGNATURE_RECOVERY_FAILED;
            throw new RedemptionException(kind, e.getMessage(), e);
        }
    }

    private void creditOrRelease(String operation, List<CertificateId> ids, AccountAddress holder, BigInteger amount) {
        try {
            creditLedger.credit(holder, amount);
        } catch (RuntimeException e) {
            claimLedger.release(ids, holder);
            ErrorLogger.logError(operation, "Credit of " + amount + " to " + holder + " failed; claims released", e);
            throw e;
        }
    }

    private static byte[] decodeSignature(String operation, String signatureHex) {
        try {
            return SignatureVerifier.decodeHex(signatureHex);
        } catch (SignatureVerificationException e) {
            ErrorLogger.logWarn(operation, "Rejected signature: " + e.getMessage());
            throw new RedemptionException(RedemptionException.Kind.INVALID_SIGNATURE_FORMAT, e.getMessage(), e);
        }
    }
}
