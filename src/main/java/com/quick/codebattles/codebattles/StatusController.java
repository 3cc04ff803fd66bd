package com.quick.codebattles.codebattles;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@CrossOrigin("*")
@RequiredArgsConstructor
public class StatusController {

    private final RoomRegistry registry;

    @GetMapping({"/", "/api/status"})
    public ResponseEntity<StatusResponse> status() {
        return ResponseEntity.ok(new StatusResponse("CodeBattles Server Running",
                registry.roomCount(), registry.totalPlayerCount()));
    }

    public record StatusResponse(String status, int rooms, int players) {
    }
}
