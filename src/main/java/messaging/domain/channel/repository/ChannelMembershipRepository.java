package messaging.domain.channel.repository;

import messaging.domain.channel.entity.ChannelMembership;
import messaging.global.enums.MembershipRole;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ChannelMembershipRepository extends JpaRepository<ChannelMembership, Long> {

    boolean existsByChannelIdAndUserId(Long channelId, Long userId);

    boolean existsByChannelIdAndUserIdAndRole(Long channelId, Long userId, MembershipRole role);

    Optional<ChannelMembership> findByChannelIdAndUserId(Long channelId, Long userId);

    long countByChannelId(Long channelId);

    long countByChannelIdAndRole(Long channelId, MembershipRole role);

    @Query("SELECT cm FROM ChannelMembership cm JOIN FETCH cm.user " +
            "WHERE cm.channel.id = :channelId " +
            "ORDER BY cm.joinedAt ASC, cm.id ASC")
    List<ChannelMembership> findMembersWithUser(@Param("channelId") Long channelId);

    @Query("SELECT cm.user.id FROM ChannelMembership cm WHERE cm.channel.id = :channelId")
    List<Long> findUserIdsByChannelId(@Param("channelId") Long channelId);

    @Query("SELECT cm FROM ChannelMembership cm JOIN FETCH cm.channel WHERE cm.user.id = :userId")
    List<ChannelMembership> findAllWithChannelByUserId(@Param("userId") Long userId);
}
