package com.scoutim.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.scoutim.domain.dto.UnreadCountRow;
import com.scoutim.domain.entity.MessageEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDateTime;
import java.util.List;

public interface MessageMapper extends BaseMapper<MessageEntity> {

    /**
     * 每个会话的最后一条消息。同一会话内 created_at 严格递增，max(created_at) 唯一。
     */
    @Select("""
            <script>
            select m.*
            from t_message m
            join (
              select thread_id, max(created_at) as max_created_at
              from t_message
              where thread_id in
              <foreach collection="threadIds" item="id" open="(" separator="," close=")">
                #{id}
              </foreach>
              group by thread_id
            ) x
              on m.thread_id = x.thread_id
             and m.created_at = x.max_created_at
            </script>
            """)
    List<MessageEntity> selectLastMessagesByThreadIds(@Param("threadIds") List<Long> threadIds);

    @Select("""
            <script>
            select thread_id, count(*) as unread_count
            from t_message
            where sender_id &lt;&gt; #{userId}
              and read_at is null
              and thread_id in
              <foreach collection="threadIds" item="id" open="(" separator="," close=")">
                #{id}
              </foreach>
            group by thread_id
            </script>
            """)
    List<UnreadCountRow> selectUnreadCountsByThreadIds(@Param("userId") long userId,
                                                      @Param("threadIds") List<Long> threadIds);

    /**
     * 标记已读。read_at 取 greatest(created_at, now)，保证 read_at 不早于 created_at。
     *
     * @return 本次从未读变为已读的条数
     */
    @Update("""
            update t_message
               set read_at = greatest(created_at, #{now})
             where thread_id = #{threadId}
               and sender_id <> #{readerId}
               and read_at is null
            """)
    int markRead(@Param("threadId") long threadId,
                 @Param("readerId") long readerId,
                 @Param("now") LocalDateTime now);

    /**
     * 用户在所有未停用会话中、创建时间不晚于 cutoff 的未读数。
     */
    @Select("""
            select count(*)
            from t_message m
            join t_thread t on t.id = m.thread_id
            where (t.user_a_id = #{userId} or t.user_b_id = #{userId})
              and t.active = true
              and m.sender_id <> #{userId}
              and m.read_at is null
              and m.created_at <= #{cutoff}
            """)
    long countUnreadOlderThan(@Param("userId") long userId, @Param("cutoff") LocalDateTime cutoff);

    /**
     * 用户在全部会话中收到的未读数，含已停用会话。
     */
    @Select("""
            select count(*)
            from t_message m
            join t_thread t on t.id = m.thread_id
            where (t.user_a_id = #{userId} or t.user_b_id = #{userId})
              and m.sender_id <> #{userId}
              and m.read_at is null
            """)
    long countUnreadForUser(@Param("userId") long userId);
}
