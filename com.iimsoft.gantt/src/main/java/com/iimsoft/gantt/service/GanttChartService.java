package com.iimsoft.gantt.service;

import com.iimsoft.gantt.api.dto.ChartRequest;
import com.iimsoft.gantt.config.ChartConfig;
import com.iimsoft.gantt.domain.Schedule;
import com.iimsoft.gantt.layout.ChartGeometry;
import com.iimsoft.gantt.layout.ChartLayoutEngine;
import com.iimsoft.gantt.log.ChartLog;
import com.iimsoft.gantt.log.Slf4jChartLog;
import com.iimsoft.gantt.persistence.SvgSceneWriter;
import com.iimsoft.gantt.scene.Scene;
import com.iimsoft.gantt.scene.SceneBuilder;
import com.iimsoft.gantt.style.ColorAssigner;

import java.util.Objects;

/**
 * request -> schedule -> geometry -> scene (-> SVG).
 */
public class GanttChartService {

    private final ScheduleAssembler assembler;
    private final ChartLayoutEngine layoutEngine;
    private final SceneBuilder sceneBuilder;
    private final SvgSceneWriter svgWriter;
    private final ChartLog log;

    public GanttChartService() {
        this(new ColorAssigner(), new Slf4jChartLog(GanttChartService.class));
    }

    public GanttChartService(ColorAssigner colorAssigner, ChartLog log) {
        this.log = Objects.requireNonNull(log, "log");
        this.assembler = new ScheduleAssembler(log);
        this.layoutEngine = new ChartLayoutEngine(colorAssigner, log);
        this.sceneBuilder = new SceneBuilder();
        this.svgWriter = new SvgSceneWriter();
    }

    public Scene render(ChartRequest request, ChartConfig config) {
        Schedule schedule = assembler.assemble(request);
        return render(schedule, config);
    }

    public Scene render(Schedule schedule, ChartConfig config) {
        ChartGeometry geometry = layoutEngine.layout(schedule, config);
        Scene scene = sceneBuilder.build(geometry, config.isAddResourceTable());
        log.output("Chart '{}': {} rows, {} months ({} .. {}), canvas {}x{}",
                geometry.getTitle(), geometry.getRows().size(), geometry.getColumns().size(),
                geometry.getStartDate(), geometry.getEndDate(), scene.getWidth(), scene.getHeight());
        return scene;
    }

    public String renderSvg(ChartRequest request, ChartConfig config) {
        return svgWriter.toSvg(render(request, config));
    }
}
