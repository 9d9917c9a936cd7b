package com.investorportal.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.investorportal.backend.modules.auth.domain.UserSession;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserSessionRepository extends JpaRepository<UserSession, UUID> {

    @Query("""
            select us
              from UserSession us
              join fetch us.user u
             where us.refreshToken = :refreshToken
               and us.revoked = false
               and us.expiresAt > :now
            """)
    Optional<UserSession> findLive(@Param("refreshToken") String refreshToken,
                                   @Param("now") OffsetDateTime now);

    /**
     * Returns 1 only for the caller that flipped the row; concurrent callers see 0.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update UserSession us
               set us.revoked = true,
                   us.updatedAt = :now
             where us.refreshToken = :refreshToken
               and us.revoked = false
            """)
    int revokeIfActive(@Param("refreshToken") String refreshToken,
                       @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update UserSession us
               set us.revoked = true,
                   us.updatedAt = :now
             where us.user.id = :userId
               and us.revoked = false
            """)
    int revokeAllActive(@Param("userId") UUID userId,
                        @Param("now") OffsetDateTime now);

    @Modifying
    @Query("""
            delete from UserSession us
             where us.expiresAt < :now
                or us.revoked = true
            """)
    int deleteExpiredOrRevoked(@Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update UserSession us
               set us.updatedAt = :now,
                   us.userAgent = coalesce(:userAgent, us.userAgent),
                   us.ipAddress = coalesce(:ipAddress, us.ipAddress)
             where us.refreshToken = :refreshToken
            """)
    int touch(@Param("refreshToken") String refreshToken,
              @Param("userAgent") String userAgent,
              @Param("ipAddress") String ipAddress,
              @Param("now") OffsetDateTime now);
}
