package com.example.configserver.service;

import com.example.configserver.model.GitEndpoint;
import org.eclipse.jgit.lib.Constants;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Maps a requested label to the ordered refs to try: the same-named local ref first, then
 * the remote-tracking ref. Without a label the tracked branch is used.
 */
@Component
public class RefResolver {

    public List<String> candidateRefs(GitEndpoint endpoint, String label) {
        String rev = label != null && !label.isEmpty() ? label : endpoint.getBranch();
        return List.of(rev, Constants.DEFAULT_REMOTE_NAME + "/" + rev);
    }
}
