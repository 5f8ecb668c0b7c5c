package com.chicu.agentpulse.ecosystem;

import java.util.List;

/**
 * Внешняя экосистема: чтение кандидатов + действия (пост, комментарий, голос).
 * Чтение ретраев не делает: упал — итерация FAILED, повтор на следующем тике.
 */
public interface EcosystemClient {

    List<ProjectSnapshot> fetchProjects();

    List<ForumPostSnapshot> fetchForumPosts(String sort, int limit);

    /**
     * Посты самого агента, новые первыми.
     */
    List<ForumPostSnapshot> fetchOwnPosts(int limit);

    List<ForumComment> fetchComments(long postId, int limit);

    /**
     * @return id созданного поста
     */
    long createPost(NewForumPost post);

    void voteForProject(long projectId);

    /**
     * @return id созданного комментария
     */
    long createComment(long postId, String body);
}
