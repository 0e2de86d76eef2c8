package com.project.certredeem.core;

import com.project.certredeem.TestSigners;
import com.project.certredeem.crypto.AccountAddress;
import com.project.certredeem.events.EventLog;
import com.project.certredeem.events.RedemptionEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CondenserDelegateRegistryTest {

    private final AccountAddress admin = TestSigners.address("admin");
    private final AccountAddress condenser = TestSigners.address("condenser");
    private final EventLog events = new EventLog();
    private final CondenserDelegateRegistry registry =
        new CondenserDelegateRegistry(new SingleAdminGate(admin), events);

    @Test
    @DisplayName("Add and remove toggle trust and emit events every time")
    void addRemove() {
        registry.addCondenserDelegate(admin, condenser);
        registry.addCondenserDelegate(admin, condenser);
        assertTrue(registry.isCondenserDelegate(condenser));
        assertEquals(Set.of(condenser), registry.condenserDelegates());

        registry.removeCondenserDelegate(admin, condenser);
        registry.removeCondenserDelegate(admin, condenser);
        assertFalse(registry.isCondenserDelegate(condenser));

        List<String> types = events.events().stream().map(RedemptionEvent::type).toList();
        assertEquals(List.of("CondenserDelegateAdded", "CondenserDelegateAdded",
            "CondenserDelegateRemoved", "CondenserDelegateRemoved"), types);
    }

    @Test
    @DisplayName("Only the admin may change the set")
    void adminOnly() {
        RedemptionException add = assertThrows(RedemptionException.class,
            () -> registry.addCondenserDelegate(condenser, condenser));
        assertEquals(RedemptionException.Kind.ADMIN_REQUIRED, add.kind());

        registry.addCondenserDelegate(admin, condenser);
        RedemptionException remove = assertThrows(RedemptionException.class,
            () -> registry.removeCondenserDelegate(condenser, condenser));
        assertEquals(RedemptionException.Kind.ADMIN_REQUIRED, remove.kind());
        assertTrue(registry.isCondenserDelegate(condenser));
    }
}
