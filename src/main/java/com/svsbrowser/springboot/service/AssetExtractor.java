package com.svsbrowser.springboot.service;

import com.svsbrowser.springboot.model.ParsedAsset;
import com.svsbrowser.springboot.model.ParsedAssetFile;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.svsbrowser.springboot.service.HtmlSupport.cleanText;
import static com.svsbrowser.springboot.service.HtmlSupport.resolveUrl;

/**
 * Turns one media-group section into an asset with its downloadable file variants.
 */
@Component
public class AssetExtractor {

    private static final Pattern SIZE = Pattern.compile("\\[(\\d+(?:\\.\\d+)?)\\s*(KB|MB|GB)\\]", Pattern.CASE_INSENSITIVE);
    private static final Pattern DIMENSIONS = Pattern.compile("\\((\\d+)\\s*[x×]\\s*(\\d+)\\)");

    private static final Map<String, String> MIME_BY_EXTENSION = new LinkedHashMap<>();

    static {
        MIME_BY_EXTENSION.put(".mp4", "video/mp4");
        MIME_BY_EXTENSION.put(".m4v", "video/mp4");
        MIME_BY_EXTENSION.put(".mov", "video/quicktime");
        MIME_BY_EXTENSION.put(".webm", "video/webm");
        MIME_BY_EXTENSION.put(".mpeg", "video/mpeg");
        MIME_BY_EXTENSION.put(".mpg", "video/mpeg");
        MIME_BY_EXTENSION.put(".avi", "video/x-msvideo");
        MIME_BY_EXTENSION.put(".png", "image/png");
        MIME_BY_EXTENSION.put(".jpg", "image/jpeg");
        MIME_BY_EXTENSION.put(".jpeg", "image/jpeg");
        MIME_BY_EXTENSION.put(".tif", "image/tiff");
        MIME_BY_EXTENSION.put(".tiff", "image/tiff");
        MIME_BY_EXTENSION.put(".gif", "image/gif");
        MIME_BY_EXTENSION.put(".vtt", "text/vtt");
        MIME_BY_EXTENSION.put(".srt", "text/plain");
    }

    /**
     * @return the asset, or null when the group has neither files nor a thumbnail
     */
    public ParsedAsset extract(Element group, int position, String baseUrl) {
        Element video = group.selectFirst("video");
        String mediaType = video != null ? ParsedAsset.VIDEO : ParsedAsset.IMAGE;

        String thumbnailUrl = null;
        if (video != null && video.hasAttr("poster") && !video.attr("poster").isBlank()) {
            thumbnailUrl = resolveUrl(baseUrl, video.attr("poster"));
        } else {
            Element image = group.selectFirst("img[src]");
            if (image != null) {
                thumbnailUrl = resolveUrl(baseUrl, image.attr("src"));
            }
        }

        String description = null;
        String captionHtml = null;
        Element cardBody = group.selectFirst("div.card-body");
        if (cardBody != null) {
            List<String> texts = new ArrayList<>();
            StringBuilder html = new StringBuilder();
            for (Element child : cardBody.children()) {
                if (!child.normalName().equals("p")) {
                    continue;
                }
                String text = cleanText(child.text());
                if (!text.isEmpty()) {
                    texts.add(text);
                    html.append(HtmlSupport.sanitizeParagraph(child, baseUrl + "/"));
                }
            }
            if (!texts.isEmpty()) {
                description = String.join(" ", texts);
                captionHtml = html.toString();
            }
        }

        List<ParsedAssetFile> files = new ArrayList<>();
        Element dropdown = group.selectFirst("ul.dropdown-menu");
        if (dropdown != null) {
            for (Element link : dropdown.select("a.dropdown-item")) {
                ParsedAssetFile file = parseDownloadLink(link, baseUrl);
                if (file != null) {
                    files.add(file);
                }
            }
        }
        if (files.isEmpty() && video != null) {
            for (Element source : video.select("source[src]")) {
                String url = resolveUrl(baseUrl, source.attr("src"));
                if (url == null) {
                    continue;
                }
                files.add(ParsedAssetFile.builder()
                        .url(url)
                        .variant(detectVariant(url))
                        .mimeType(source.hasAttr("type") ? source.attr("type") : null)
                        .filename(filename(url))
                        .build());
            }
        }

        if (files.isEmpty() && thumbnailUrl == null) {
            return null;
        }

        return ParsedAsset.builder()
                .mediaType(mediaType)
                .description(description)
                .captionText(description)
                .captionHtml(captionHtml)
                .thumbnailUrl(thumbnailUrl)
                .position(position)
                .files(files)
                .build();
    }

    /**
     * Parses a download menu entry such as {@code "file.mp4 (1920x1080) [650.0 MB]"}.
     */
    ParsedAssetFile parseDownloadLink(Element link, String baseUrl) {
        String href = link.attr("href");
        if (href.isBlank()) {
            return null;
        }
        String url = resolveUrl(baseUrl, href);
        String text = cleanText(link.text());

        Long sizeBytes = null;
        Matcher size = SIZE.matcher(text);
        if (size.find()) {
            sizeBytes = toBytes(Double.parseDouble(size.group(1)), size.group(2));
        }

        Integer width = null;
        Integer height = null;
        Matcher dimensions = DIMENSIONS.matcher(text);
        if (dimensions.find()) {
            width = Integer.parseInt(dimensions.group(1));
            height = Integer.parseInt(dimensions.group(2));
        }

        return ParsedAssetFile.builder()
                .url(url)
                .variant(detectVariant(url))
                .width(width)
                .height(height)
                .sizeBytes(sizeBytes)
                .mimeType(detectMimeType(url))
                .filename(filename(url))
                .build();
    }

    static long toBytes(double size, String unit) {
        long multiplier;
        switch (unit.toUpperCase(Locale.ROOT)) {
            case "KB":
                multiplier = 1024L;
                break;
            case "MB":
                multiplier = 1024L * 1024L;
                break;
            case "GB":
                multiplier = 1024L * 1024L * 1024L;
                break;
            default:
                multiplier = 1L;
        }
        return (long) (size * multiplier);
    }

    /**
     * Classifies a file by keywords in its URL; the first match wins.
     */
    static String detectVariant(String url) {
        String u = url.toLowerCase(Locale.ROOT);
        if (u.contains("4k") || u.contains("uhd")) return "4k";
        if (u.contains("1080") || u.contains("hd")) return "1080p";
        if (u.contains("720")) return "720p";
        if (u.contains("prores")) return "prores";
        if (u.contains("h264")) return "h264";
        if (u.contains("appletv")) return "appletv";
        if (u.contains("webm")) return "webm";
        if (u.contains("ipod") || u.contains("podcast")) return "mobile";
        if (u.contains("thumbnail") || u.contains("thm")) return "thumbnail";
        if (u.contains("print")) return "print";
        if (u.contains("searchweb")) return "web";
        if (u.contains(".srt") || u.contains(".vtt")) return "caption";
        if (u.contains("transcript")) return "transcript";
        return "original";
    }

    static String detectMimeType(String url) {
        String u = url.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : MIME_BY_EXTENSION.entrySet()) {
            if (u.endsWith(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    static String filename(String url) {
        int slash = url.lastIndexOf('/');
        if (slash < 0 || slash == url.length() - 1) {
            return null;
        }
        return url.substring(slash + 1);
    }
}
