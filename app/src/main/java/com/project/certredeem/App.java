package com.project.certredeem;

import com.project.certredeem.core.CondensedAmountPolicy;
import com.project.certredeem.core.InMemoryCreditLedger;
import com.project.certredeem.core.RedemptionException;
import com.project.certredeem.core.RedemptionService;
import com.project.certredeem.core.SingleAdminGate;
import com.project.certredeem.crypto.AccountAddress;
import com.project.certredeem.crypto.CertificateId;
import com.project.certredeem.crypto.ErrorLogger;
import com.project.certredeem.crypto.SignatureVerifier;
import com.project.certredeem.events.EventLog;
import com.project.certredeem.eth.EngineSettings;
import com.project.certredeem.io.EventLogWriter;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * End-to-end walk through one service instance with throwaway keys: create two certificate
 * types, redeem one singly, redeem both condensed for a second holder, show the double-redemption
 * rejection, and export the event log.
 *
 * <p>If {@code REDEEM_SERVICE_ADDRESS}/{@code REDEEM_ADMIN_ADDRESS} (or a deployment file) are
 * configured they are used for the service address and policy; otherwise random addresses are generated.</p>
 */
public class App {
    public static void main(String[] args) {
        try {
            ECKeyPair adminKey = Keys.createEcKeyPair();
            ECKeyPair delegateKey = Keys.createEcKeyPair();
            ECKeyPair condenserKey = Keys.createEcKeyPair();
            AccountAddress admin = addressOf(adminKey);
            AccountAddress delegate = addressOf(delegateKey);
            AccountAddress condenser = addressOf(condenserKey);
            AccountAddress alice = addressOf(Keys.createEcKeyPair());
            AccountAddress bob = addressOf(Keys.createEcKeyPair());

            AccountAddress serviceAddress;
            CondensedAmountPolicy policy;
            try {
                EngineSettings settings = EngineSettings.fromEnvironment();
                serviceAddress = settings.serviceAddress();
                policy = settings.condensedPolicy();
                System.out.println("Using configured network: " + settings.network());
            } catch (IllegalStateException e) {
                serviceAddress = addressOf(Keys.createEcKeyPair());
                policy = CondensedAmountPolicy.RECOMPUTED;
                System.out.println("No deployment configured, using a random service address.");
            }
            System.out.println("Service address:         " + serviceAddress.toChecksumHex());
            System.out.println("Condensed amount policy: " + policy.id());

            EventLog eventLog = new EventLog();
            InMemoryCreditLedger ledger = new InMemoryCreditLedger();
            RedemptionService service = new RedemptionService(
                    serviceAddress, new SingleAdminGate(admin), ledger, policy, eventLog);

            CertificateId c1 = service.createCertificateType(admin, BigInteger.valueOf(100), List.of(delegate), "ipfs://x");
            CertificateId c2 = service.createCertificateType(admin, BigInteger.valueOf(50), List.of(delegate), "ipfs://y");
            service.addCondenserDelegate(admin, condenser);
            System.out.println("Certificate c1: " + c1);
            System.out.println("Certificate c2: " + c2);

            byte[] aliceHash = service.computeRedemptionHash(c1, alice);
            String aliceSignature = sign(aliceHash, delegateKey);
            service.redeem(alice, aliceSignature, c1);
            System.out.printf("Alice redeemed c1, balance: %s%n", ledger.balanceOf(alice));

            try {
                service.redeem(alice, aliceSignature, c1);
            } catch (RedemptionException e) {
                System.out.printf("Second redemption rejected: %s%n", e.kind());
            }

            List<CertificateId> both = List.of(c1, c2);
            BigInteger combined = BigInteger.valueOf(150);
            byte[] bobHash = service.computeCondensedRedemptionHash(service.computeCondensedIDsHash(both), combined, bob);
            service.redeemCondensed(bob, sign(bobHash, condenserKey), combined, both);
            System.out.printf("Bob redeemed [c1, c2] condensed, balance: %s%n", ledger.balanceOf(bob));

            Path outbox = Paths.get("outbox");
            Path exported = new EventLogWriter(outbox).write(serviceAddress.toHex(), eventLog.events());
            System.out.printf("%d events exported to: %s%n", eventLog.size(), exported.toAbsolutePath());
        } catch (Exception e) {
            ErrorLogger.logError("App.main", "Demo run failed", e);
            System.exit(1);
        }
    }

    private static AccountAddress addressOf(ECKeyPair keyPair) {
        return AccountAddress.fromPublicKey(keyPair.getPublicKey());
    }

    private static String sign(byte[] messageHash, ECKeyPair keyPair) {
        Sign.SignatureData signature = Sign.signPrefixedMessage(messageHash, keyPair);
        return Numeric.toHexString(SignatureVerifier.toBytes(signature));
    }
}
