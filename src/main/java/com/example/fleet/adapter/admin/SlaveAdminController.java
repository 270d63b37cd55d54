package com.example.fleet.adapter.admin;

import com.example.fleet.core.slave.SlaveInfo;
import com.example.fleet.core.slave.SlaveManager;
import com.example.fleet.core.store.RevokedCredential;
import com.example.fleet.core.store.SlaveRecord;
import com.example.fleet.core.store.SlaveStore;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping(path = "/admin/slaves", produces = MediaType.APPLICATION_JSON_VALUE)
public class SlaveAdminController {
    private final SlaveManager manager;
    private final SlaveStore store;
    private final Clock clock;

    public SlaveAdminController(SlaveManager manager, SlaveStore store, Clock clock) {
        this.manager = manager;
        this.store = store;
        this.clock = clock;
    }

    @GetMapping
    public Map<String, List<SlaveInfo>> list() {
        return Map.of("slaves", manager.getRegistry().getAllSlaves());
    }

    /**
     * Adds a host to the roster with the serial of the certificate issued to it.
     */
    public record EnrollReq(String hostId, String certSerial, String platform, Instant expiresAt) {}

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public SlaveRecord enroll(@RequestBody EnrollReq req) {
        if (req.hostId() == null || req.hostId().isBlank() || req.certSerial() == null || req.certSerial().isBlank()) {
            throw new IllegalArgumentException("hostId and certSerial are required");
        }
        Instant now = clock.instant();
        Instant expiresAt = req.expiresAt() == null ? now.plusSeconds(365L * 24 * 3600) : req.expiresAt();
        return store.createSlave(req.hostId(), req.certSerial().toLowerCase(Locale.ROOT), req.platform(), now, expiresAt);
    }

    @GetMapping("/revoked")
    public Map<String, List<RevokedCredential>> revoked() {
        return Map.of("revoked", manager.listRevokedCredentials());
    }

    public record RevokeReq(String reason) {}

    @PostMapping("/{host}/revoke")
    public Map<String, Object> revoke(@PathVariable("host") String host, @RequestBody(required = false) RevokeReq req) {
        manager.revokeCredential(host, req == null || req.reason() == null ? "" : req.reason());
        return Map.of("ok", true);
    }

    @PostMapping("/{host}/enable")
    public Map<String, Object> enable(@PathVariable("host") String host) {
        manager.setSlaveEnabled(host, true);
        return Map.of("ok", true);
    }

    @PostMapping("/{host}/disable")
    public Map<String, Object> disable(@PathVariable("host") String host) {
        manager.setSlaveEnabled(host, false);
        return Map.of("ok", true);
    }

    @PostMapping("/{host}/restart")
    public Map<String, Object> restart(@PathVariable("host") String host) {
        manager.restartSlave(host);
        return Map.of("ok", true);
    }

    @PostMapping("/{host}/upgrade")
    public Map<String, Object> upgrade(@PathVariable("host") String host) {
        manager.upgradeSlave(host);
        return Map.of("ok", true);
    }
}
