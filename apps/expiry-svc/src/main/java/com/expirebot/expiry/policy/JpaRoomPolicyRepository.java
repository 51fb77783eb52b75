package com.expirebot.expiry.policy;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaRoomPolicyRepository extends JpaRepository<RoomPolicyEntity, String> {

    List<RoomPolicyEntity> findAllByOrderByRoomIdAsc();

    // bulk delete so the database-level ON DELETE CASCADE removes tracked entries in the same statement
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from RoomPolicyEntity p where p.roomId = :roomId")
    int deleteByRoomId(@Param("roomId") String roomId);
}
