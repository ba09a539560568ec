package com.productscoutai.core.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.productscoutai.core.model.LinkInfo;
import com.productscoutai.core.model.NodeContext;

import java.util.List;

/** AI 요청 프롬프트. 모든 요청은 같은 페르소나(system)를 쓴다. */
public final class PromptTemplates {
    private PromptTemplates() {}

    private static final ObjectMapper M = new ObjectMapper();

    public static final String SYSTEM_PERSONA =
            "You are an architect. You want to find the product information from a supplier's website. "
            + "You are clicking the button to go to the production description page.";

    static final String SCORING_INSTRUCTION =
            "You come to a page with a list of links. Here is the ID, relative path and anchor text of each link.\n"
            + "Score them from 0 - 10 according to how likely the link will lead you to the product description page.\n"
            + "A score less than 1 is for links you will never click.\n"
            + "A score higher than 9 is for links you think is very likely to be the product description page "
            + "of a specific product. For these kind of link, you will also tell the product name.";

    static final String SCORING_OUTPUT =
            "Please format your response as JSON with the following structure:\n"
            + "[\n"
            + "    {\"id\": 0, \"score\": 3.4},\n"
            + "    {\"id\": 1, \"score\": 7.8},\n"
            + "    {\"id\": 2, \"score\": 9.5, \"productName\": \"Emerald Urethane Trim Enamel\"},\n"
            + "    ...\n"
            + "]\n\n"
            + "IMPORTANT:\n"
            + "- Include the 'id' field for each item to match it with the corresponding link\n"
            + "- Provide exactly one score object for each link\n"
            + "- Include 'productName' only when score > 9.0";

    static final String DETECTION_INSTRUCTION =
            "On this page, you found multiple links to product description pages. According to the UI elements "
            + "on this page, do you think the page uses dynamic loading? If yes, output the element's id and tell "
            + "its trigger type (select one from: Pagination, Load More, Tabs, Accordions, Expanders), if no, "
            + "you answer with {\"id\": -1}.";

    static final String DETECTION_OUTPUT =
            "Please format your response as JSON with the following structure:\n"
            + "{\"id\": 3, \"triggerType\": \"Pagination\"}\n\n"
            + "IMPORTANT:\n"
            + "- If no dynamic loading is detected, return {\"id\": -1}\n"
            + "- Valid trigger types are: Pagination, Load More, Tabs, Accordions, Expanders";

    public static String scoringRequest(NodeContext page, List<LinkInfo> batch) {
        ArrayNode arr = M.createArrayNode();
        for (LinkInfo li : batch) {
            ObjectNode o = arr.addObject();
            o.put("id", li.getId());
            o.put("relative_path", li.getRelativePath());
            o.put("anchor_text", li.getAnchorText());
        }
        return pageHeader(page)
                + SCORING_INSTRUCTION + "\n\nLinks to analyze:\n" + pretty(arr)
                + "\n\n" + SCORING_OUTPUT;
    }

    public static String detectionRequest(NodeContext page, List<LinkInfo> batch) {
        ArrayNode arr = M.createArrayNode();
        for (LinkInfo li : batch) {
            ObjectNode o = arr.addObject();
            o.put("id", li.getId());
            o.put("relative_path", li.getRelativePath());
            o.put("anchor_text", li.getAnchorText());
            o.put("tag_context", li.getTagContext());
        }
        return pageHeader(page)
                + DETECTION_INSTRUCTION + "\n\nHere is the list of elements:\n" + pretty(arr)
                + "\n\n" + DETECTION_OUTPUT;
    }

    private static String pageHeader(NodeContext page) {
        StringBuilder sb = new StringBuilder();
        sb.append("Current page: ").append(page.url()).append('\n');
        if (!page.title().isBlank()) sb.append("Title: ").append(page.title()).append('\n');
        if (!page.description().isBlank()) sb.append("Description: ").append(page.description()).append('\n');
        return sb.append('\n').toString();
    }

    private static String pretty(ArrayNode arr) {
        try {
            return M.writerWithDefaultPrettyPrinter().writeValueAsString(arr);
        } catch (Exception e) {
            return arr.toString();
        }
    }
}
