package com.project.certredeem.core;

import com.project.certredeem.TestSigners;
import com.project.certredeem.crypto.AccountAddress;
import com.project.certredeem.crypto.CertificateId;
import com.project.certredeem.crypto.IdentityHasher;
import com.project.certredeem.events.EventLog;
import com.project.certredeem.events.RedemptionEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Certificate registry")
class CertificateRegistryTest {

    private final AccountAddress service = TestSigners.address("service");
    private final AccountAddress admin = TestSigners.address("admin");
    private final AccountAddress delegate = TestSigners.address("delegate");
    private final AccountAddress stranger = TestSigners.address("stranger");

    private EventLog events;
    private CertificateRegistry registry;

    @BeforeEach
    void setUp() {
        events = new EventLog();
        registry = new CertificateRegistry(service, new SingleAdminGate(admin), new ClaimLedger(), events);
    }

    @Nested
    @DisplayName("Creation")
    class Creation {

        @Test
        @DisplayName("Returns the derived id and stores amount, metadata and delegates")
        void storesType() {
            CertificateId id = registry.createCertificateType(admin, BigInteger.valueOf(100), List.of(delegate), "ipfs://x");

            assertEquals(IdentityHasher.computeCertificateID(BigInteger.valueOf(100), service, List.of(delegate), "ipfs://x"), id);
            assertEquals(BigInteger.valueOf(100), registry.getCertificateAmount(id));
            assertEquals("ipfs://x", registry.getCertificateMetadata(id));
            assertTrue(registry.isDelegate(id, delegate));
            assertFalse(registry.isDelegate(id, stranger));
            assertTrue(registry.exists(id));
        }

        @Test
        @DisplayName("Identical parameters are idempotent and emit the event again")
        void idempotent() {
            CertificateId first = registry.createCertificateType(admin, BigInteger.TEN, List.of(delegate), "m");
            CertificateId second = registry.createCertificateType(admin, BigInteger.TEN, List.of(delegate), "m");

            assertEquals(first, second);
            assertEquals(1, registry.size());
            assertEquals(2, events.eventsOfType(RedemptionEvent.CertificateTypeCreated.class).size());
        }

        @Test
        @DisplayName("Zero amount and empty delegate list are accepted")
        void degenerateTypes() {
            CertificateId id = registry.createCertificateType(admin, BigInteger.ZERO, List.of(), "");
            assertTrue(registry.exists(id));
            assertEquals(BigInteger.ZERO, registry.getCertificateAmount(id));
            assertTrue(registry.findCertificateType(id).orElseThrow().delegates().isEmpty());
        }

        @Test
        @DisplayName("Non-admin callers are rejected without side effects")
        void adminOnly() {
            RedemptionException e = assertThrows(RedemptionException.class, () ->
                registry.createCertificateType(stranger, BigInteger.TEN, List.of(delegate), "m"));

            assertEquals(RedemptionException.Kind.ADMIN_REQUIRED, e.kind());
            assertEquals(0, registry.size());
            assertEquals(0, events.size());
        }

        @Test
        @DisplayName("Out-of-range amounts and null delegates are invalid input")
        void invalidInput() {
            assertThrows(InputValidator.InvalidInputException.class, () ->
                registry.createCertificateType(admin, BigInteger.valueOf(-1), List.of(), ""));
            assertThrows(InputValidator.InvalidInputException.class, () ->
                registry.createCertificateType(admin, BigInteger.ONE, java.util.Arrays.asList(delegate, null), ""));
            assertThrows(InputValidator.InvalidInputException.class, () ->
                registry.createCertificateType(admin, BigInteger.ONE, List.of(), null));
        }
    }

    @Nested
    @DisplayName("Reads")
    class Reads {

        @Test
        @DisplayName("Unknown ids read as zero values")
        void unknownIds() {
            CertificateId unknown = CertificateId.of(new byte[32]);

            assertEquals(BigInteger.ZERO, registry.getCertificateAmount(unknown));
            assertEquals("", registry.getCertificateMetadata(unknown));
            assertFalse(registry.isDelegate(unknown, delegate));
            assertFalse(registry.isClaimed(unknown, delegate));
            assertFalse(registry.exists(unknown));
            assertEquals(Optional.empty(), registry.findCertificateType(unknown));
        }

        @Test
        @DisplayName("Snapshot exposes the delegate set")
        void snapshot() {
            AccountAddress other = TestSigners.address("other-delegate");
            CertificateId id = registry.createCertificateType(admin, BigInteger.ONE, List.of(delegate, other), "m");

            CertificateType type = registry.findCertificateType(id).orElseThrow();

            assertEquals(id, type.id());
            assertEquals(BigInteger.ONE, type.amount());
            assertEquals("m", type.metadata());
            assertTrue(type.isDelegate(delegate));
            assertTrue(type.isDelegate(other));
            assertEquals(2, type.delegates().size());
        }
    }
}
