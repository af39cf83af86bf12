package org.dxworks.plcframe.export;

import org.dxworks.plcframe.cfg.BasicBlock;
import org.dxworks.plcframe.cfg.CfgEdge;
import org.dxworks.plcframe.cfg.ControlFlowGraph;
import org.dxworks.plcframe.dataflow.CrossDependency;
import org.dxworks.plcframe.dataflow.RoutineFacts;
import org.dxworks.plcframe.dataflow.RoutineRef;
import org.dxworks.plcframe.fsm.CompositeFsm;
import org.dxworks.plcframe.fsm.FsmModel;
import org.dxworks.plcframe.model.Controller;
import org.dxworks.plcframe.project.AggregationResult;
import org.dxworks.plcframe.project.Conflict;
import org.dxworks.plcframe.project.ProjectIR;
import org.dxworks.plcframe.validation.Diagnostic;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps analysis results onto the flat report shapes consumed by graph emitters and
 * the JSONL report.
 */
public final class Exporter {

    private Exporter() {
    }

    public static RoutineGraph graph(RoutineRef ref, ControlFlowGraph cfg) {
        RoutineGraph graph = new RoutineGraph();
        graph.controller = ref.getController();
        graph.program = ref.getProgram();
        graph.routine = ref.getRoutine();
        for (BasicBlock block : cfg.getBlocks()) {
            GraphNode node = new GraphNode();
            node.id = block.getId();
            node.label = block.getLabel();
            node.type = block.getType().getName();
            node.routine = cfg.getRoutine();
            node.defs.addAll(block.getDefs());
            node.uses.addAll(block.getUses());
            graph.nodes.add(node);
        }
        for (CfgEdge edge : cfg.getEdges()) {
            GraphEdge out = new GraphEdge();
            out.source = edge.getSource();
            out.target = edge.getTarget();
            out.flowType = edge.getFlowType().getName();
            out.value = edge.getValue();
            graph.edges.add(out);
        }
        return graph;
    }

    public static DependencyRecord dependency(CrossDependency dependency) {
        DependencyRecord record = new DependencyRecord();
        record.tag = dependency.getTag();
        record.writer = dependency.getWriter();
        record.readers.addAll(dependency.getReaders());
        record.dataType = dependency.getDataType();
        return record;
    }

    public static ConflictRecord conflict(Conflict conflict) {
        ConflictRecord record = new ConflictRecord();
        record.tag = conflict.getTag();
        record.conflictType = conflict.getKind().getName();
        record.controllers.addAll(conflict.getControllers());
        record.details.putAll(conflict.getDetails());
        return record;
    }

    /**
     * Per-controller summary. {@code facts} supplies the annotated CFGs and is only read
     * when {@code includeGraphs} is set.
     */
    public static ControllerReport controller(Controller controller, FsmModel fsm, List<Diagnostic> diagnostics,
                                              List<RoutineFacts> facts, boolean includeGraphs) {
        ControllerReport report = new ControllerReport();
        report.name = controller.getName();
        report.sourceType = controller.getSourceType().getName();
        report.valid = controller.isValid();
        report.hasOverlay = controller.hasOverlay();
        report.programs = controller.getPrograms().size();
        report.routines = controller.getPrograms().stream().mapToInt(p -> p.getRoutines().size()).sum();
        report.tags = controller.getTags().size()
                + controller.getPrograms().stream().mapToInt(p -> p.getTags().size()).sum();
        report.udts = controller.getUdts().size();
        report.diagnostics.addAll(diagnostics);
        report.fsm = fsm;
        if (includeGraphs) {
            report.graphs.addAll(graphs(controller, facts));
        }
        return report;
    }

    public static ProjectReport project(AggregationResult aggregation, CompositeFsm composite) {
        ProjectIR project = aggregation.getProject();
        ProjectReport report = new ProjectReport();
        report.controllers.addAll(project.getControllerNames());
        report.sharedTags.addAll(project.sharedTagCandidates());
        report.missingOverlays.addAll(aggregation.getMissingOverlays());
        project.findCrossPlcDependencies().forEach(d -> report.crossPlcDependencies.add(dependency(d)));
        project.crossRoutineFlows().forEach(d -> report.crossRoutineFlows.add(dependency(d)));
        project.detectConflictingTags().forEach(c -> report.conflicts.add(conflict(c)));
        if (composite != null) {
            report.linkedTransitions.addAll(composite.getLinkedTransitions());
        }
        report.diagnostics.addAll(project.getDiagnostics());
        return report;
    }

    /** Annotated CFGs of the controller's routines, in program then routine order. */
    public static List<RoutineGraph> graphs(Controller controller, List<RoutineFacts> facts) {
        List<RoutineGraph> graphs = new ArrayList<>();
        for (RoutineFacts routineFacts : facts) {
            if (routineFacts.getRef().getController().equals(controller.getName())) {
                graphs.add(graph(routineFacts.getRef(), routineFacts.getCfg()));
            }
        }
        return graphs;
    }
}
