package ch.uzh.ifi.grading.model;

import ch.uzh.ifi.grading.model.constants.IsolationTool;
import ch.uzh.ifi.grading.model.constants.ResourceLimit;
import com.google.common.base.Joiner;
import lombok.Value;

import java.util.Set;

/**
 * What the host can actually enforce on sandboxed children. Produced once at startup by probing the host, so that
 * callers can tell best-effort ceilings apart from real namespace isolation.
 */
@Value
public class SandboxCapabilities {
    boolean enabled;
    IsolationTool isolationTool;
    Set<ResourceLimit> limits;
    boolean processGroups;

    public static SandboxCapabilities disabled() {
        return new SandboxCapabilities(false, IsolationTool.NONE, Set.of(), false);
    }

    public boolean isStronglyIsolated() {
        return enabled && isolationTool.isAvailable();
    }

    public boolean hasLimits() {
        return enabled && !limits.isEmpty();
    }

    public String describe() {
        if (!enabled)
            return "disabled";
        if (isStronglyIsolated())
            return isolationTool.getName();
        return hasLimits() ? "resource_limits(" + Joiner.on(",").join(limits) + ")" : "none";
    }
}
