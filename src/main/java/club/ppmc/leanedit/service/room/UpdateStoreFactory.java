/**
 * UpdateStoreFactory.java
 *
 * Derives the persistence handle of a room from its name.
 */
package club.ppmc.leanedit.service.room;

@FunctionalInterface
public interface UpdateStoreFactory {

    UpdateStore create(String roomName);
}
