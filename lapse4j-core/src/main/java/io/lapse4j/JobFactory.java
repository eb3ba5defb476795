package io.lapse4j;

import io.lapse4j.core.JobKind;
import io.lapse4j.core.SubjectKind;

/**
 * Creates the job body run when a subject of {@link #subjectKind()} fires.
 *
 * @param <T> typed settings the subject's free-form settings map is converted into
 */
public interface JobFactory<T> {

    SubjectKind subjectKind();

    JobKind jobKind();

    Class<T> settingsClass();

    JobBody create(String subjectId, T settings);
}
