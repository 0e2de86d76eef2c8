package com.project.certredeem.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.project.certredeem.crypto.AccountAddress;
import com.project.certredeem.crypto.CertificateId;
import com.project.certredeem.events.RedemptionEvent;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Exports recorded events to a JSON file. Addresses and ids are written as {@code 0x}-hex,
 * amounts as decimal strings so uint256 values survive JavaScript readers.
 */
public class EventLogWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path outputDirectory;

    public EventLogWriter(Path outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    public Path write(String serviceAddress, List<RedemptionEvent> events) throws IOException {
        Files.createDirectories(outputDirectory);

        Instant exportedAt = Instant.now();
        String fileName = "events-" + DateTimeFormatter.ISO_INSTANT.format(exportedAt) + ".json";
        Path target = outputDirectory.resolve(fileName.replace(":", "_"));

        ObjectNode root = MAPPER.createObjectNode();
        root.put("service", serviceAddress);
        root.put("exportedAt", exportedAt.toString());
        ArrayNode array = root.putArray("events");
        events.forEach(event -> array.add(toJson(event)));

        MAPPER.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), root);
        return target;
    }

    static ObjectNode toJson(RedemptionEvent event) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", event.type());
        if (event instanceof RedemptionEvent.CertificateTypeCreated) {
            RedemptionEvent.CertificateTypeCreated created = (RedemptionEvent.CertificateTypeCreated) event;
            node.put("certificateId", created.certificateId().toHex());
            node.put("amount", created.amount().toString());
            ArrayNode delegates = node.putArray("delegates");
            created.delegates().stream().map(AccountAddress::toHex).forEach(delegates::add);
        } else if (event instanceof RedemptionEvent.Redeemed) {
            RedemptionEvent.Redeemed redeemed = (RedemptionEvent.Redeemed) event;
            node.put("holder", redeemed.holder().toHex());
            node.put("amount", redeemed.amount().toString());
            node.put("certificateId", redeemed.certificateId().toHex());
        } else if (event instanceof RedemptionEvent.CondensedRedeemed) {
            RedemptionEvent.CondensedRedeemed condensed = (RedemptionEvent.CondensedRedeemed) event;
            node.put("holder", condensed.holder().toHex());
            node.put("amount", condensed.amount().toString());
            ArrayNode ids = node.putArray("certificateIds");
            condensed.certificateIds().stream().map(CertificateId::toHex).forEach(ids::add);
        } else if (event instanceof RedemptionEvent.CondenserDelegateChanged) {
            RedemptionEvent.CondenserDelegateChanged changed = (RedemptionEvent.CondenserDelegateChanged) event;
            node.put("delegate", changed.delegate().toHex());
        }
        return node;
    }
}
