package com.scholary.call.transcriber.demux;

import com.scholary.call.transcriber.audio.ChannelRole;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps container track numbers to channel roles.
 *
 * <p>Built while the stream is read: every track entry announces its number and name, and the
 * name is looked up in the configured name-to-role table.
 */
public class TrackRoleMap {

  private final Map<String, ChannelRole> rolesByName;
  private final Map<Long, ChannelRole> rolesByTrack = new ConcurrentHashMap<>();

  public TrackRoleMap(Map<String, ChannelRole> rolesByName) {
    this.rolesByName = Map.copyOf(rolesByName);
  }

  public static TrackRoleMap of(String callerTrackName, String agentTrackName) {
    return new TrackRoleMap(
        Map.of(callerTrackName, ChannelRole.CALLER, agentTrackName, ChannelRole.AGENT));
  }

  /** Record a track entry. Unknown names are ignored. */
  void register(long trackNumber, String trackName) {
    if (trackName == null) {
      return;
    }
    ChannelRole role = rolesByName.get(trackName);
    if (role != null) {
      rolesByTrack.put(trackNumber, role);
    }
  }

  public Optional<ChannelRole> roleOf(long trackNumber) {
    return Optional.ofNullable(rolesByTrack.get(trackNumber));
  }
}
