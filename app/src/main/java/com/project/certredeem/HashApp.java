package com.project.certredeem;

import com.project.certredeem.core.InputValidator;
import com.project.certredeem.crypto.AccountAddress;
import com.project.certredeem.crypto.CertificateId;
import com.project.certredeem.crypto.ErrorLogger;
import com.project.certredeem.crypto.IdentityHasher;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Prints the digests a delegate or condenser must sign, so off-line signers can check their
 * encoding against this implementation.
 *
 * Usage:
 * <pre>
 *   HashApp certificate-id &lt;service&gt; &lt;amount&gt; &lt;metadata&gt; [delegate...]
 *   HashApp redemption-hash &lt;service&gt; &lt;certificateId&gt; &lt;holder&gt;
 *   HashApp condensed-ids-hash &lt;certificateId&gt;...
 *   HashApp condensed-redemption-hash &lt;service&gt; &lt;holder&gt; &lt;combinedAmount&gt; &lt;certificateId&gt;...
 * </pre>
 */
public class HashApp {

    public static void main(String[] args) {
        if (args.length < 1) {
            printUsage();
            System.exit(1);
        }
        try {
            System.out.println(run(args));
        } catch (IllegalArgumentException e) {
            ErrorLogger.logError("HashApp.main", e.getMessage(), null);
            printUsage();
            System.exit(1);
        }
    }

    static String run(String[] args) {
        String command = args[0];
        List<String> rest = Arrays.asList(args).subList(1, args.length);
        switch (command) {
            case "certificate-id": {
                requireArgs(command, rest, 3);
                AccountAddress service = InputValidator.parseAddress(rest.get(0), "service");
                BigInteger amount = InputValidator.parseAmount(rest.get(1), "amount");
                String metadata = rest.get(2);
                List<AccountAddress> delegates = rest.subList(3, rest.size()).stream()
                        .map(value -> InputValidator.parseAddress(value, "delegate"))
                        .collect(Collectors.toList());
                return IdentityHasher.computeCertificateID(amount, service, delegates, metadata).toHex();
            }
            case "redemption-hash": {
                requireArgs(command, rest, 3);
                AccountAddress service = InputValidator.parseAddress(rest.get(0), "service");
                CertificateId id = InputValidator.parseCertificateId(rest.get(1), "certificateId");
                AccountAddress holder = InputValidator.parseAddress(rest.get(2), "holder");
                return Numeric.toHexString(IdentityHasher.computeRedemptionHash(id, service, holder));
            }
            case "condensed-ids-hash": {
                requireArgs(command, rest, 1);
                return Numeric.toHexString(IdentityHasher.computeCondensedIDsHash(parseIds(rest)));
            }
            case "condensed-redemption-hash": {
                requireArgs(command, rest, 4);
                AccountAddress service = InputValidator.parseAddress(rest.get(0), "service");
                AccountAddress holder = InputValidator.parseAddress(rest.get(1), "holder");
                BigInteger combined = InputValidator.parseAmount(rest.get(2), "combinedAmount");
                byte[] idsHash = IdentityHasher.computeCondensedIDsHash(parseIds(rest.subList(3, rest.size())));
                return Numeric.toHexString(
                        IdentityHasher.computeCondensedRedemptionHash(idsHash, combined, holder, service));
            }
            default:
                throw new IllegalArgumentException("Unknown command: " + command);
        }
    }

    private static List<CertificateId> parseIds(List<String> values) {
        return values.stream()
                .map(value -> InputValidator.parseCertificateId(value, "certificateId"))
                .collect(Collectors.toList());
    }

    private static void requireArgs(String command, List<String> args, int min) {
        if (args.size() < min) {
            throw new IllegalArgumentException(
                String.format("%s needs at least %d arguments, got %d", command, min, args.size()));
        }
    }

    private static void printUsage() {
        System.err.println("Usage:");
        System.err.println("  HashApp certificate-id <service> <amount> <metadata> [delegate...]");
        System.err.println("  HashApp redemption-hash <service> <certificateId> <holder>");
        System.err.println("  HashApp condensed-ids-hash <certificateId>...");
        System.err.println("  HashApp condensed-redemption-hash <service> <holder> <combinedAmount> <certificateId>...");
    }
}
