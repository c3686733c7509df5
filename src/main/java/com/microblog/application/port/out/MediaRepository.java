package com.microblog.application.port.out;

import com.microblog.domain.model.Media;

import java.util.Collection;
import java.util.List;

public interface MediaRepository {
    void save(Media media);
    List<Media> findByIds(Collection<Long> ids);
}
