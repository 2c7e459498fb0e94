package messaging.domain.channel.repository;

import messaging.domain.channel.entity.Channel;
import messaging.global.enums.MembershipRole;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ChannelRepository extends JpaRepository<Channel, Long> {

    /**
     * 요청자가 해당 채널의 관리자일 때만 이름을 변경합니다.
     * 권한 확인과 변경이 하나의 UPDATE 문으로 처리되므로 확인 후 권한이 바뀌는 경쟁이 없습니다.
     *
     * @return 변경된 행 수 (0 또는 1)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Channel c SET c.name = :name " +
            "WHERE c.id = :channelId " +
            "AND EXISTS (" +
            "  SELECT cm.id FROM ChannelMembership cm " +
            "  WHERE cm.channel.id = :channelId AND cm.user.id = :actorId AND cm.role = :role" +
            ")")
    int renameIfAdmin(@Param("channelId") Long channelId,
                      @Param("name") String name,
                      @Param("actorId") Long actorId,
                      @Param("role") MembershipRole role);
}
