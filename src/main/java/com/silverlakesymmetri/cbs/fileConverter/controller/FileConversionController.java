package com.silverlakesymmetri.cbs.fileConverter.controller;

import com.silverlakesymmetri.cbs.fileConverter.config.FormatConfigLoader;
import com.silverlakesymmetri.cbs.fileConverter.config.model.FormatConfig;
import com.silverlakesymmetri.cbs.fileConverter.dto.ConversionRequest;
import com.silverlakesymmetri.cbs.fileConverter.dto.ConversionResponse;
import com.silverlakesymmetri.cbs.fileConverter.dto.PruneRequest;
import com.silverlakesymmetri.cbs.fileConverter.service.ConversionResult;
import com.silverlakesymmetri.cbs.fileConverter.service.FileConversionService;
import com.silverlakesymmetri.cbs.fileConverter.service.PruneService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/iotrans")
public class FileConversionController {

	private static final Logger logger = LoggerFactory.getLogger(FileConversionController.class);

	private final FileConversionService fileConversionService;
	private final PruneService pruneService;
	private final FormatConfigLoader formatConfigLoader;

	public FileConversionController(FileConversionService fileConversionService, PruneService pruneService,
									FormatConfigLoader formatConfigLoader) {
		this.fileConversionService = fileConversionService;
		this.pruneService = pruneService;
		this.formatConfigLoader = formatConfigLoader;
	}

	// ==================== Convert ====================

	@PostMapping("/to-file")
	public ResponseEntity<ConversionResponse> toFile(@RequestBody ConversionRequest request) throws Exception {
		logger.info("Conversion request received: {}", request);
		ConversionResult result = fileConversionService.convert(request);

		ConversionResponse response = new ConversionResponse(
				result.isSuccessful() ? "COMPLETED" : "PARTIAL",
				result.getOutputs().size() + " output(s) written");
		response.setResourceId(result.getResourceId());
		response.setOutputs(result.getOutputs());
		if (!result.isSuccessful()) {
			response.setFailures(result.getFailures());
		}
		return ResponseEntity.ok(response);
	}

	// ==================== Prune ====================

	@PostMapping("/prune")
	public ResponseEntity<ConversionResponse> prune(@RequestBody PruneRequest request) throws Exception {
		String path = request == null ? null : request.getPath();
		pruneService.prune(path);
		return ResponseEntity.ok(new ConversionResponse("PRUNED", "Deleted " + path));
	}

	// ==================== Supported Formats ====================

	@GetMapping("/formats")
	public ResponseEntity<Map<String, Object>> formats() {
		FormatConfig config = formatConfigLoader.getFormatConfig();
		Map<String, Object> response = new LinkedHashMap<>();
		response.put("spatialFormats", config.getSpatialFormats());
		response.put("nonSpatialFormats", config.getNonSpatialFormats());
		response.put("supportedEpsgs", config.getSupportedEpsgs());
		return ResponseEntity.ok(response);
	}
}
