package microservices.helper.monkeyregistry.controller;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;

import microservices.helper.monkeyregistry.dto.ExportRequest;
import microservices.helper.monkeyregistry.dto.ExportResult;
import microservices.helper.monkeyregistry.dto.ImportRequest;
import microservices.helper.monkeyregistry.dto.ImportResult;
import microservices.helper.monkeyregistry.entity.MonkeyRecord;
import microservices.helper.monkeyregistry.model.MonkeyFilter;
import microservices.helper.monkeyregistry.service.MonkeyExportService;
import microservices.helper.monkeyregistry.service.MonkeyImportService;
import microservices.helper.monkeyregistry.service.MonkeyRegistryService;
import microservices.helper.monkeyregistry.service.TransferPathResolver;

@RestController
@RequestMapping("/monkeys")
@Slf4j
public class MonkeyController {

	private final MonkeyRegistryService monkeyRegistryService;
	private final MonkeyImportService monkeyImportService;
	private final MonkeyExportService monkeyExportService;
	private final TransferPathResolver transferPathResolver;

	public MonkeyController(MonkeyRegistryService monkeyRegistryService, MonkeyImportService monkeyImportService,
			MonkeyExportService monkeyExportService, TransferPathResolver transferPathResolver) {
		this.monkeyRegistryService = monkeyRegistryService;
		this.monkeyImportService = monkeyImportService;
		this.monkeyExportService = monkeyExportService;
		this.transferPathResolver = transferPathResolver;
	}

	@PostMapping
	public ResponseEntity<MonkeyRecord> create(@RequestBody MonkeyRecord monkey) {
		log.info("Received request to create monkey: name={}, species={}", monkey.getName(), monkey.getSpecies());
		return ResponseEntity.status(HttpStatus.CREATED).body(monkeyRegistryService.create(monkey));
	}

	@GetMapping("/{monkeyId}")
	public ResponseEntity<MonkeyRecord> get(@PathVariable("monkeyId") String monkeyId) {
		return ResponseEntity.of(monkeyRegistryService.get(monkeyId));
	}

	@PatchMapping("/{monkeyId}")
	public ResponseEntity<MonkeyRecord> update(@PathVariable("monkeyId") String monkeyId, @RequestBody MonkeyRecord updates) {
		log.info("Received request to update monkey {}", monkeyId);
		return ResponseEntity.of(monkeyRegistryService.update(monkeyId, updates));
	}

	@DeleteMapping("/{monkeyId}")
	public ResponseEntity<Void> delete(@PathVariable("monkeyId") String monkeyId) {
		log.info("Received request to delete monkey {}", monkeyId);
		if (monkeyRegistryService.delete(monkeyId)) {
			return ResponseEntity.noContent().build();
		}
		return ResponseEntity.notFound().build();
	}

	@GetMapping
	public List<MonkeyRecord> list(@RequestParam(name = "name", required = false) String name,
			@RequestParam(name = "species", required = false) String species) {
		return monkeyRegistryService.list(MonkeyFilter.of(name, species));
	}

	@GetMapping("/search")
	public List<MonkeyRecord> search(@RequestParam(name = "q", defaultValue = "") String query) {
		return monkeyRegistryService.search(query);
	}

	@PostMapping("/import")
	public ImportResult importMonkeys(@Valid @RequestBody ImportRequest request) {
		log.info("Received request to import monkeys from {}", request.getFile());
		return monkeyImportService.importFile(transferPathResolver.resolve(request.getFile()), request.getMode(), request.isDryRun());
	}

	@PostMapping("/export")
	public ExportResult exportMonkeys(@Valid @RequestBody ExportRequest request) {
		log.info("Received request to export monkeys to {}", request.getFile());
		return monkeyExportService.export(transferPathResolver.resolve(request.getFile()),
				MonkeyFilter.of(request.getName(), request.getSpecies()), request.isPretty(), request.isForce());
	}

}
