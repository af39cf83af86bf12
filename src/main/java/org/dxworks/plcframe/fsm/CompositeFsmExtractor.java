package org.dxworks.plcframe.fsm;

import org.dxworks.plcframe.model.Controller;
import org.dxworks.plcframe.project.ProjectIR;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Extracts one FSM per controller and links transitions across controllers: a
 * transition that writes a tag is linked to every transition of another controller
 * whose guard reads that tag.
 */
public final class CompositeFsmExtractor {

    private CompositeFsmExtractor() {
    }

    public static CompositeFsm extract(ProjectIR project) {
        return extract(project, name -> FsmConfig.EMPTY);
    }

    public static CompositeFsm extract(ProjectIR project, Function<String, FsmConfig> configs) {
        List<FsmModel> fsms = new ArrayList<>();
        for (Controller controller : project.getControllers()) {
            fsms.add(FsmExtractor.extract(controller, configs.apply(controller.getName())));
        }

        List<LinkedTransition> links = new ArrayList<>();
        SortedSet<String> shared = new TreeSet<>();
        for (FsmModel writer : fsms) {
            for (FsmModel reader : fsms) {
                if (writer == reader) {
                    continue;
                }
                for (FsmTransition written : writer.getTransitions()) {
                    for (FsmTransition read : reader.getTransitions()) {
                        SortedSet<String> common = new TreeSet<>(written.getWrittenTags());
                        common.retainAll(read.getGuardTags());
                        if (!common.isEmpty()) {
                            links.add(new LinkedTransition(writer.getController(), written,
                                    reader.getController(), read, new ArrayList<>(common)));
                            shared.addAll(common);
                        }
                    }
                }
            }
        }
        return new CompositeFsm(project.getControllerNames(), fsms, links, new ArrayList<>(shared));
    }
}
