package com.oilevels.api.controller;

import com.oilevels.api.dto.response.LevelsPreviewResponse;
import com.oilevels.exception.BadRequestException;
import com.oilevels.levels.LevelsService;
import java.io.IOException;
import java.util.Locale;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for generating support/resistance levels from option-chain workbooks.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/levels} -- upload a workbook, download it with Total and Max sheets added</li>
 *   <li>{@code POST /api/levels/preview} -- upload a workbook, get the latest day's top levels as JSON</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/levels")
public class LevelsController {

    static final MediaType XLSX =
            MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");
    static final MediaType XLS = MediaType.parseMediaType("application/vnd.ms-excel");

    private final LevelsService levelsService;

    public LevelsController(LevelsService levelsService) {
        this.levelsService = levelsService;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<byte[]> generate(@RequestParam("file") MultipartFile file) throws IOException {
        byte[] output = levelsService.generate(requireContent(file));

        String filename = processedFilename(file.getOriginalFilename());
        return ResponseEntity.ok()
                .contentType(filename.toLowerCase(Locale.ROOT).endsWith(".xls") ? XLS : XLSX)
                .header(
                        HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(filename).build().toString())
                .body(output);
    }

    @PostMapping(value = "/preview", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public LevelsPreviewResponse preview(@RequestParam("file") MultipartFile file) throws IOException {
        return LevelsPreviewResponse.from(levelsService.preview(requireContent(file)));
    }

    private byte[] requireContent(MultipartFile file) throws IOException {
        if (file.isEmpty()) {
            throw new BadRequestException("Uploaded workbook is empty");
        }
        return file.getBytes();
    }

    /** "Nifty expiry.xlsx" becomes "Nifty expiry_processed.xlsx". */
    static String processedFilename(String originalFilename) {
        String name = StringUtils.getFilename(originalFilename);
        if (!StringUtils.hasText(name)) {
            return "levels_processed.xlsx";
        }
        String extension = StringUtils.getFilenameExtension(name);
        String root = StringUtils.stripFilenameExtension(name);
        if (!StringUtils.hasText(root)) {
            root = "levels";
        }
        return root + "_processed." + (StringUtils.hasText(extension) ? extension : "xlsx");
    }
}
