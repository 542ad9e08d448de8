package com.novoiceCluster.Realtime.services;

import com.novoiceCluster.Realtime.model.ChannelInfo;
import com.novoiceCluster.Realtime.model.Participant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Membership directory backed by the keys the CRUD application maintains in Redis.
 *
 * Redis Key Structure:
 * - server:{ID}:members   : Set of member user ids
 * - server:{ID}:owner     : Owner user id
 * - channel:{ID}          : Hash (serverId, type, name)
 * - user:{ID}:servers     : Set of server ids the user belongs to
 * - user:{ID}:profile     : Hash (username, displayName, avatarColor)
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RedisMembershipDirectory implements MembershipDirectory {

    private final StringRedisTemplate redisTemplate;

    @Override
    public boolean isMember(String userId, String serverId) {
        if (userId == null || serverId == null) {
            return false;
        }
        Boolean member = redisTemplate.opsForSet().isMember("server:" + serverId + ":members", userId);
        return Boolean.TRUE.equals(member);
    }

    @Override
    public boolean isOwner(String userId, String serverId) {
        if (userId == null || serverId == null) {
            return false;
        }
        return userId.equals(redisTemplate.opsForValue().get("server:" + serverId + ":owner"));
    }

    @Override
    public Optional<ChannelInfo> findChannel(String channelId) {
        if (channelId == null) {
            return Optional.empty();
        }
        HashOperations<String, String, String> hash = redisTemplate.opsForHash();
        Map<String, String> fields = hash.entries("channel:" + channelId);
        if (fields.isEmpty() || fields.get("serverId") == null) {
            return Optional.empty();
        }
        return Optional.of(new ChannelInfo(
                channelId,
                fields.get("serverId"),
                fields.get("type"),
                fields.get("name")
        ));
    }

    @Override
    public List<String> serverIdsOf(String userId) {
        Set<String> ids = redisTemplate.opsForSet().members("user:" + userId + ":servers");
        return ids == null ? List.of() : new ArrayList<>(ids);
    }

    @Override
    public Optional<Participant> findUser(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        HashOperations<String, String, String> hash = redisTemplate.opsForHash();
        Map<String, String> profile = hash.entries("user:" + userId + ":profile");
        if (profile.isEmpty()) {
            return Optional.empty();
        }
        String username = profile.get("username");
        String displayName = profile.getOrDefault("displayName", username);
        return Optional.of(new Participant(userId, username, displayName, profile.get("avatarColor")));
    }
}
