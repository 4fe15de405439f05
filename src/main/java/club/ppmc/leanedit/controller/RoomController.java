/**
 * RoomController.java
 *
 * Lists the shared document rooms that exist in this server instance.
 */
package club.ppmc.leanedit.controller;

import club.ppmc.leanedit.service.RoomRegistry;
import club.ppmc.leanedit.service.room.DocumentRoom;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/rooms")
public class RoomController {

    private final RoomRegistry roomRegistry;

    public RoomController(RoomRegistry roomRegistry) {
        this.roomRegistry = roomRegistry;
    }

    @GetMapping
    public ResponseEntity<List<RoomStatus>> listRooms() {
        return ResponseEntity.ok(roomRegistry.rooms().stream().map(RoomStatus::of).toList());
    }

    public record RoomStatus(String name, int clients, boolean ready, boolean loadFailed) {

        static RoomStatus of(DocumentRoom room) {
            return new RoomStatus(
                    room.getName(), room.clientCount(), room.isReady(), room.loadFailure().isPresent());
        }
    }
}
