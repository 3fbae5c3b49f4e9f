package com.shortly.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.shortly.backend.modules.auth.domain.OAuthAccount;
import com.shortly.backend.modules.auth.domain.OAuthProvider;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OAuthAccountRepository extends JpaRepository<OAuthAccount, UUID> {

    @Query("""
            select oa
              from OAuthAccount oa
              join fetch oa.user
             where oa.provider = :provider
               and oa.providerAccountId = :providerAccountId
            """)
    Optional<OAuthAccount> findByProviderAccount(@Param("provider") OAuthProvider provider,
                                                 @Param("providerAccountId") String providerAccountId);

    @Query("""
            select case when count(oa) > 0 then true else false end
              from OAuthAccount oa
             where oa.user.id = :userId
               and oa.provider = :provider
            """)
    boolean existsForUser(@Param("userId") UUID userId, @Param("provider") OAuthProvider provider);
}
