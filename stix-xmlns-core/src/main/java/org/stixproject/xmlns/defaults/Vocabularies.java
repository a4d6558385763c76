/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.stixproject.xmlns.defaults;

/**
 * Built-in vocabularies: XML infrastructure, STIX 1.1.1, CybOX 2.1 and the
 * third-party extension namespaces commonly used by STIX documents.
 */
public final class Vocabularies {

    private Vocabularies() {
    }

    public static final String NAMESPACE_XSI = "http://www.w3.org/2001/XMLSchema-instance";
    public static final String NAMESPACE_XS = "http://www.w3.org/2001/XMLSchema";
    public static final String NAMESPACE_XLINK = "http://www.w3.org/1999/xlink";
    public static final String NAMESPACE_DS = "http://www.w3.org/2000/09/xmldsig#";

    public static final String NAMESPACE_STIX = "http://stix.mitre.org/stix-1";
    public static final String NAMESPACE_STIX_COMMON = "http://stix.mitre.org/common-1";
    public static final String NAMESPACE_STIX_VOCABS = "http://stix.mitre.org/default_vocabularies-1";

    public static final String NAMESPACE_CYBOX = "http://cybox.mitre.org/cybox-2";
    public static final String NAMESPACE_CYBOX_COMMON = "http://cybox.mitre.org/common-2";
    public static final String NAMESPACE_CYBOX_VOCABS = "http://cybox.mitre.org/default_vocabularies-2";

    private static final String STIX_XSD = "http://stix.mitre.org/XMLSchema/";
    private static final String CYBOX_XSD = "http://cybox.mitre.org/XMLSchema/";
    private static final String CYBOX_OBJECTS = "http://cybox.mitre.org/objects#";
    private static final String CYBOX_OBJECT_XSD = CYBOX_XSD + "objects/";

    /**
     * Core XML infrastructure namespaces. None of them gets a schema location.
     */
    public static final Vocabulary XML = Vocabulary.builder("XML")
            .add(NAMESPACE_XSI, "xsi")
            .add(NAMESPACE_XS, "xs")
            .add(NAMESPACE_XLINK, "xlink")
            .add(NAMESPACE_DS, "ds")
            .build();

    public static final Vocabulary STIX = Vocabulary.builder("STIX 1.1.1")
            .add(NAMESPACE_STIX, "stix", STIX_XSD + "core/1.1.1/stix_core.xsd")
            .add(NAMESPACE_STIX_COMMON, "stixCommon", STIX_XSD + "common/1.1.1/stix_common.xsd")
            .add(NAMESPACE_STIX_VOCABS, "stixVocabs",
                    STIX_XSD + "default_vocabularies/1.1.1/stix_default_vocabularies.xsd")
            .add("http://data-marking.mitre.org/Marking-1", "marking",
                    STIX_XSD + "data_marking/1.1.1/data_marking.xsd")
            .add("http://data-marking.mitre.org/extensions/MarkingStructure#Simple-1", "simpleMarking",
                    STIX_XSD + "extensions/marking/simple/1.1.1/simple_marking.xsd")
            .add("http://data-marking.mitre.org/extensions/MarkingStructure#TLP-1", "tlpMarking",
                    STIX_XSD + "extensions/marking/tlp/1.1.1/tlp_marking.xsd")
            .add("http://data-marking.mitre.org/extensions/MarkingStructure#Terms_Of_Use-1", "TOUMarking",
                    STIX_XSD + "extensions/marking/terms_of_use/1.0.1/terms_of_use_marking.xsd")
            .add("http://stix.mitre.org/Campaign-1", "campaign", STIX_XSD + "campaign/1.1.1/campaign.xsd")
            .add("http://stix.mitre.org/CourseOfAction-1", "coa",
                    STIX_XSD + "course_of_action/1.1.1/course_of_action.xsd")
            .add("http://stix.mitre.org/ExploitTarget-1", "et", STIX_XSD + "exploit_target/1.1.1/exploit_target.xsd")
            .add("http://stix.mitre.org/Incident-1", "incident", STIX_XSD + "incident/1.1.1/incident.xsd")
            .add("http://stix.mitre.org/Indicator-2", "indicator", STIX_XSD + "indicator/2.1.1/indicator.xsd")
            .add("http://stix.mitre.org/TTP-1", "ttp", STIX_XSD + "ttp/1.1.1/ttp.xsd")
            .add("http://stix.mitre.org/ThreatActor-1", "ta", STIX_XSD + "threat_actor/1.1.1/threat_actor.xsd")
            .add("http://stix.mitre.org/extensions/AP#CAPEC2.7-1", "stix-capec",
                    STIX_XSD + "extensions/attack_pattern/capec_2.7/1.0.1/capec_2.7_attack_pattern.xsd")
            .add("http://stix.mitre.org/extensions/Address#CIQAddress3.0-1", "stix-ciqaddress",
                    STIX_XSD + "extensions/address/ciq_3.0/1.1.1/ciq_3.0_address.xsd")
            .add("http://stix.mitre.org/extensions/Identity#CIQIdentity3.0-1", "ciqIdentity",
                    STIX_XSD + "extensions/identity/ciq_3.0/1.1.1/ciq_3.0_identity.xsd")
            .add("http://stix.mitre.org/extensions/Malware#MAEC4.1-1", "stix-maec",
                    STIX_XSD + "extensions/malware/maec_4.1/1.0.1/maec_4.1_malware.xsd")
            .add("http://stix.mitre.org/extensions/StructuredCOA#Generic-1", "genericStructuredCOA",
                    STIX_XSD + "extensions/structured_coa/generic/1.1.1/generic_structured_coa.xsd")
            .add("http://stix.mitre.org/extensions/TestMechanism#Generic-1", "genericTM",
                    STIX_XSD + "extensions/test_mechanism/generic/1.1.1/generic_test_mechanism.xsd")
            .add("http://stix.mitre.org/extensions/TestMechanism#OVAL5.10-1", "stix-oval",
                    STIX_XSD + "extensions/test_mechanism/oval_5.10/1.1.1/oval_5.10_test_mechanism.xsd")
            .add("http://stix.mitre.org/extensions/TestMechanism#OpenIOC2010-1", "stix-openioc",
                    STIX_XSD + "extensions/test_mechanism/open_ioc_2010/1.1.1/open_ioc_2010_test_mechanism.xsd")
            .add("http://stix.mitre.org/extensions/TestMechanism#Snort-1", "snortTM",
                    STIX_XSD + "extensions/test_mechanism/snort/1.1.1/snort_test_mechanism.xsd")
            .add("http://stix.mitre.org/extensions/TestMechanism#YARA-1", "yaraTM",
                    STIX_XSD + "extensions/test_mechanism/yara/1.1.1/yara_test_mechanism.xsd")
            .add("http://stix.mitre.org/extensions/Vulnerability#CVRF-1", "stix-cvrf",
                    STIX_XSD + "extensions/vulnerability/cvrf_1.1/1.1.1/cvrf_1.1_vulnerability.xsd")
            .build();

    public static final Vocabulary CYBOX = Vocabulary.builder("CybOX 2.1")
            .add(NAMESPACE_CYBOX, "cybox", CYBOX_XSD + "core/2.1/cybox_core.xsd")
            .add(NAMESPACE_CYBOX_COMMON, "cyboxCommon", CYBOX_XSD + "common/2.1/cybox_common.xsd")
            .add(NAMESPACE_CYBOX_VOCABS, "cyboxVocabs",
                    CYBOX_XSD + "default_vocabularies/2.1/cybox_default_vocabularies.xsd")
            .add(CYBOX_OBJECTS + "APIObject-2", "APIObj", CYBOX_OBJECT_XSD + "API/2.1/API_Object.xsd")
            .add(CYBOX_OBJECTS + "AccountObject-2", "AccountObj",
                    CYBOX_OBJECT_XSD + "Account/2.1/Account_Object.xsd")
            .add(CYBOX_OBJECTS + "AddressObject-2", "AddressObj",
                    CYBOX_OBJECT_XSD + "Address/2.1/Address_Object.xsd")
            .add(CYBOX_OBJECTS + "ArchiveFileObject-1", "ArchiveFileObj",
                    CYBOX_OBJECT_XSD + "Archive_File/1.0/Archive_File_Object.xsd")
            .add(CYBOX_OBJECTS + "ARPCacheObject-1", "ARPCacheObj",
                    CYBOX_OBJECT_XSD + "ARP_Cache/1.0/ARP_Cache_Object.xsd")
            .add(CYBOX_OBJECTS + "ArtifactObject-2", "ArtifactObj",
                    CYBOX_OBJECT_XSD + "Artifact/2.1/Artifact_Object.xsd")
            .add(CYBOX_OBJECTS + "ASObject-1", "ASObj", CYBOX_OBJECT_XSD + "AS/1.0/AS_Object.xsd")
            .add(CYBOX_OBJECTS + "CodeObject-2", "CodeObj", CYBOX_OBJECT_XSD + "Code/2.1/Code_Object.xsd")
            .add(CYBOX_OBJECTS + "CustomObject-1", "CustomObj",
                    CYBOX_OBJECT_XSD + "Custom/1.1/Custom_Object.xsd")
            .add(CYBOX_OBJECTS + "DeviceObject-2", "DeviceObj",
                    CYBOX_OBJECT_XSD + "Device/2.1/Device_Object.xsd")
            .add(CYBOX_OBJECTS + "DiskObject-2", "DiskObj", CYBOX_OBJECT_XSD + "Disk/2.1/Disk_Object.xsd")
            .add(CYBOX_OBJECTS + "DiskPartitionObject-2", "DiskPartitionObj",
                    CYBOX_OBJECT_XSD + "Disk_Partition/2.1/Disk_Partition_Object.xsd")
            .add(CYBOX_OBJECTS + "DNSCacheObject-2", "DNSCacheObj",
                    CYBOX_OBJECT_XSD + "DNS_Cache/2.1/DNS_Cache_Object.xsd")
            .add(CYBOX_OBJECTS + "DNSQueryObject-2", "DNSQueryObj",
                    CYBOX_OBJECT_XSD + "DNS_Query/2.1/DNS_Query_Object.xsd")
            .add(CYBOX_OBJECTS + "DNSRecordObject-2", "DNSRecordObj",
                    CYBOX_OBJECT_XSD + "DNS_Record/2.1/DNS_Record_Object.xsd")
            .add(CYBOX_OBJECTS + "DomainNameObject-1", "DomainNameObj",
                    CYBOX_OBJECT_XSD + "Domain_Name/1.0/Domain_Name_Object.xsd")
            .add(CYBOX_OBJECTS + "EmailMessageObject-2", "EmailMessageObj",
                    CYBOX_OBJECT_XSD + "Email_Message/2.1/Email_Message_Object.xsd")
            .add(CYBOX_OBJECTS + "FileObject-2", "FileObj", CYBOX_OBJECT_XSD + "File/2.1/File_Object.xsd")
            .add(CYBOX_OBJECTS + "GUIDialogboxObject-2", "GUIDialogBoxObj",
                    CYBOX_OBJECT_XSD + "GUI_Dialogbox/2.1/GUI_Dialogbox_Object.xsd")
            .add(CYBOX_OBJECTS + "GUIObject-2", "GUIObj", CYBOX_OBJECT_XSD + "GUI/2.1/GUI_Object.xsd")
            .add(CYBOX_OBJECTS + "GUIWindowObject-2", "GUIWindowObj",
                    CYBOX_OBJECT_XSD + "GUI_Window/2.1/GUI_Window_Object.xsd")
            .add(CYBOX_OBJECTS + "HostnameObject-1", "HostnameObj",
                    CYBOX_OBJECT_XSD + "Hostname/1.0/Hostname_Object.xsd")
            .add(CYBOX_OBJECTS + "HTTPSessionObject-2", "HTTPSessionObj",
                    CYBOX_OBJECT_XSD + "HTTP_Session/2.1/HTTP_Session_Object.xsd")
            .add(CYBOX_OBJECTS + "ImageFileObject-1", "ImageFileObj",
                    CYBOX_OBJECT_XSD + "Image_File/1.0/Image_File_Object.xsd")
            .add(CYBOX_OBJECTS + "LibraryObject-2", "LibraryObj",
                    CYBOX_OBJECT_XSD + "Library/2.1/Library_Object.xsd")
            .add(CYBOX_OBJECTS + "LinkObject-1", "LinkObj", CYBOX_OBJECT_XSD + "Link/1.1/Link_Object.xsd")
            .add(CYBOX_OBJECTS + "LinuxPackageObject-2", "LinuxPackageObj",
                    CYBOX_OBJECT_XSD + "Linux_Package/2.1/Linux_Package_Object.xsd")
            .add(CYBOX_OBJECTS + "MemoryObject-2", "MemoryObj",
                    CYBOX_OBJECT_XSD + "Memory/2.1/Memory_Object.xsd")
            .add(CYBOX_OBJECTS + "MutexObject-2", "MutexObj", CYBOX_OBJECT_XSD + "Mutex/2.1/Mutex_Object.xsd")
            .add(CYBOX_OBJECTS + "NetworkConnectionObject-2", "NetworkConnectionObj",
                    CYBOX_OBJECT_XSD + "Network_Connection/2.1/Network_Connection_Object.xsd")
            .add(CYBOX_OBJECTS + "NetworkFlowObject-2", "NetFlowObj",
                    CYBOX_OBJECT_XSD + "Network_Flow/2.1/Network_Flow_Object.xsd")
            .add(CYBOX_OBJECTS + "NetworkPacketObject-2", "PacketObj",
                    CYBOX_OBJECT_XSD + "Network_Packet/2.1/Network_Packet_Object.xsd")
            .add(CYBOX_OBJECTS + "NetworkRouteEntryObject-2", "NetworkRouteEntryObj",
                    CYBOX_OBJECT_XSD + "Network_Route_Entry/2.1/Network_Route_Entry_Object.xsd")
            .add(CYBOX_OBJECTS + "NetworkRouteObject-2", "NetworkRouteObj",
                    CYBOX_OBJECT_XSD + "Network_Route/2.1/Network_Route_Object.xsd")
            .add(CYBOX_OBJECTS + "NetworkSocketObject-2", "NetworkSocketObj",
                    CYBOX_OBJECT_XSD + "Network_Socket/2.1/Network_Socket_Object.xsd")
            .add(CYBOX_OBJECTS + "NetworkSubnetObject-2", "NetworkSubnetObj",
                    CYBOX_OBJECT_XSD + "Network_Subnet/2.1/Network_Subnet_Object.xsd")
            .add(CYBOX_OBJECTS + "PDFFileObject-1", "PDFFileObj",
                    CYBOX_OBJECT_XSD + "PDF_File/1.1/PDF_File_Object.xsd")
            .add(CYBOX_OBJECTS + "PipeObject-2", "PipeObj", CYBOX_OBJECT_XSD + "Pipe/2.1/Pipe_Object.xsd")
            .add(CYBOX_OBJECTS + "PortObject-2", "PortObj", CYBOX_OBJECT_XSD + "Port/2.1/Port_Object.xsd")
            .add(CYBOX_OBJECTS + "ProcessObject-2", "ProcessObj",
                    CYBOX_OBJECT_XSD + "Process/2.1/Process_Object.xsd")
            .add(CYBOX_OBJECTS + "ProductObject-2", "ProductObj",
                    CYBOX_OBJECT_XSD + "Product/2.1/Product_Object.xsd")
            .add(CYBOX_OBJECTS + "SemaphoreObject-2", "SemaphoreObj",
                    CYBOX_OBJECT_XSD + "Semaphore/2.1/Semaphore_Object.xsd")
            .add(CYBOX_OBJECTS + "SMSMessageObject-1", "SMSMessageObj",
                    CYBOX_OBJECT_XSD + "SMS_Message/1.0/SMS_Message_Object.xsd")
            .add(CYBOX_OBJECTS + "SocketAddressObject-1", "SocketAddressObj",
                    CYBOX_OBJECT_XSD + "Socket_Address/1.1/Socket_Address_Object.xsd")
            .add(CYBOX_OBJECTS + "SystemObject-2", "SystemObj",
                    CYBOX_OBJECT_XSD + "System/2.1/System_Object.xsd")
            .add(CYBOX_OBJECTS + "UnixFileObject-2", "UnixFileObj",
                    CYBOX_OBJECT_XSD + "Unix_File/2.1/Unix_File_Object.xsd")
            .add(CYBOX_OBJECTS + "UnixNetworkRouteEntryObject-2", "UnixNetworkRouteEntryObj",
                    CYBOX_OBJECT_XSD + "Unix_Network_Route_Entry/2.1/Unix_Network_Route_Entry_Object.xsd")
            .add(CYBOX_OBJECTS + "UnixPipeObject-2", "UnixPipeObj",
                    CYBOX_OBJECT_XSD + "Unix_Pipe/2.1/Unix_Pipe_Object.xsd")
            .add(CYBOX_OBJECTS + "UnixProcessObject-2", "UnixProcessObj",
                    CYBOX_OBJECT_XSD + "Unix_Process/2.1/Unix_Process_Object.xsd")
            .add(CYBOX_OBJECTS + "UnixUserAccountObject-2", "UnixUserAccountObj",
                    CYBOX_OBJECT_XSD + "Unix_User_Account/2.1/Unix_User_Account_Object.xsd")
            .add(CYBOX_OBJECTS + "UnixVolumeObject-2", "UnixVolumeObj",
                    CYBOX_OBJECT_XSD + "Unix_Volume/2.1/Unix_Volume_Object.xsd")
            .add(CYBOX_OBJECTS + "URIObject-2", "URIObj", CYBOX_OBJECT_XSD + "URI/2.1/URI_Object.xsd")
            .add(CYBOX_OBJECTS + "URLHistoryObject-1", "URLHistoryObj",
                    CYBOX_OBJECT_XSD + "URL_History/1.0/URL_History_Object.xsd")
            .add(CYBOX_OBJECTS + "UserAccountObject-2", "UserAccountObj",
                    CYBOX_OBJECT_XSD + "User_Account/2.1/User_Account_Object.xsd")
            .add(CYBOX_OBJECTS + "UserSessionObject-2", "UserSessionObj",
                    CYBOX_OBJECT_XSD + "User_Session/2.1/User_Session_Object.xsd")
            .add(CYBOX_OBJECTS + "VolumeObject-2", "VolumeObj",
                    CYBOX_OBJECT_XSD + "Volume/2.1/Volume_Object.xsd")
            .add(CYBOX_OBJECTS + "WhoisObject-2", "WhoisObj", CYBOX_OBJECT_XSD + "Whois/2.1/Whois_Object.xsd")
            .add(CYBOX_OBJECTS + "WinComputerAccountObject-2", "WinComputerAccountObj",
                    CYBOX_OBJECT_XSD + "Win_Computer_Account/2.1/Win_Computer_Account_Object.xsd")
            .add(CYBOX_OBJECTS + "WinCriticalSectionObject-2", "WinCriticalSectionObj",
                    CYBOX_OBJECT_XSD + "Win_Critical_Section/2.1/Win_Critical_Section_Object.xsd")
            .add(CYBOX_OBJECTS + "WinDriverObject-3", "WinDriverObj",
                    CYBOX_OBJECT_XSD + "Win_Driver/3.0/Win_Driver_Object.xsd")
            .add(CYBOX_OBJECTS + "WinEventLogObject-2", "WinEventLogObj",
                    CYBOX_OBJECT_XSD + "Win_Event_Log/2.1/Win_Event_Log_Object.xsd")
            .add(CYBOX_OBJECTS + "WinEventObject-2", "WinEventObj",
                    CYBOX_OBJECT_XSD + "Win_Event/2.1/Win_Event_Object.xsd")
            .add(CYBOX_OBJECTS + "WinExecutableFileObject-2", "WinExecutableFileObj",
                    CYBOX_OBJECT_XSD + "Win_Executable_File/2.1/Win_Executable_File_Object.xsd")
            .add(CYBOX_OBJECTS + "WinFilemappingObject-1", "WinFilemappingObj",
                    CYBOX_OBJECT_XSD + "Win_Filemapping/1.0/Win_Filemapping_Object.xsd")
            .add(CYBOX_OBJECTS + "WinFileObject-2", "WinFileObj",
                    CYBOX_OBJECT_XSD + "Win_File/2.1/Win_File_Object.xsd")
            .add(CYBOX_OBJECTS + "WinHandleObject-2", "WinHandleObj",
                    CYBOX_OBJECT_XSD + "Win_Handle/2.1/Win_Handle_Object.xsd")
            .add(CYBOX_OBJECTS + "WinHookObject-1", "WinHookObj",
                    CYBOX_OBJECT_XSD + "Win_Hook/1.0/Win_Hook_Object.xsd")
            .add(CYBOX_OBJECTS + "WinKernelHookObject-2", "WinKernelHookObj",
                    CYBOX_OBJECT_XSD + "Win_Kernel_Hook/2.1/Win_Kernel_Hook_Object.xsd")
            .add(CYBOX_OBJECTS + "WinKernelObject-2", "WinKernelObj",
                    CYBOX_OBJECT_XSD + "Win_Kernel/2.1/Win_Kernel_Object.xsd")
            .add(CYBOX_OBJECTS + "WinMailslotObject-2", "WinMailslotObj",
                    CYBOX_OBJECT_XSD + "Win_Mailslot/2.1/Win_Mailslot_Object.xsd")
            .add(CYBOX_OBJECTS + "WinMemoryPageRegionObject-2", "WinMemoryPageRegionObj",
                    CYBOX_OBJECT_XSD + "Win_Memory_Page_Region/2.1/Win_Memory_Page_Region_Object.xsd")
            .add(CYBOX_OBJECTS + "WinMutexObject-2", "WinMutexObj",
                    CYBOX_OBJECT_XSD + "Win_Mutex/2.1/Win_Mutex_Object.xsd")
            .add(CYBOX_OBJECTS + "WinNetworkRouteEntryObject-2", "WinNetworkRouteEntryObj",
                    CYBOX_OBJECT_XSD + "Win_Network_Route_Entry/2.1/Win_Network_Route_Entry_Object.xsd")
            .add(CYBOX_OBJECTS + "WinNetworkShareObject-2", "WinNetworkShareObj",
                    CYBOX_OBJECT_XSD + "Win_Network_Share/2.1/Win_Network_Share_Object.xsd")
            .add(CYBOX_OBJECTS + "WinPipeObject-2", "WinPipeObj",
                    CYBOX_OBJECT_XSD + "Win_Pipe/2.1/Win_Pipe_Object.xsd")
            .add(CYBOX_OBJECTS + "WinPrefetchObject-2", "WinPrefetchObj",
                    CYBOX_OBJECT_XSD + "Win_Prefetch/2.1/Win_Prefetch_Object.xsd")
            .add(CYBOX_OBJECTS + "WinProcessObject-2", "WinProcessObj",
                    CYBOX_OBJECT_XSD + "Win_Process/2.1/Win_Process_Object.xsd")
            .add(CYBOX_OBJECTS + "WinRegistryKeyObject-2", "WinRegistryKeyObj",
                    CYBOX_OBJECT_XSD + "Win_Registry_Key/2.1/Win_Registry_Key_Object.xsd")
            .add(CYBOX_OBJECTS + "WinSemaphoreObject-2", "WinSemaphoreObj",
                    CYBOX_OBJECT_XSD + "Win_Semaphore/2.1/Win_Semaphore_Object.xsd")
            .add(CYBOX_OBJECTS + "WinServiceObject-2", "WinServiceObj",
                    CYBOX_OBJECT_XSD + "Win_Service/2.1/Win_Service_Object.xsd")
            .add(CYBOX_OBJECTS + "WinSystemObject-2", "WinSystemObj",
                    CYBOX_OBJECT_XSD + "Win_System/2.1/Win_System_Object.xsd")
            .add(CYBOX_OBJECTS + "WinSystemRestoreObject-2", "WinSystemRestoreObj",
                    CYBOX_OBJECT_XSD + "Win_System_Restore/2.1/Win_System_Restore_Object.xsd")
            .add(CYBOX_OBJECTS + "WinTaskObject-2", "WinTaskObj",
                    CYBOX_OBJECT_XSD + "Win_Task/2.1/Win_Task_Object.xsd")
            .add(CYBOX_OBJECTS + "WinThreadObject-2", "WinThreadObj",
                    CYBOX_OBJECT_XSD + "Win_Thread/2.1/Win_Thread_Object.xsd")
            .add(CYBOX_OBJECTS + "WinUserAccountObject-2", "WinUserAccountObj",
                    CYBOX_OBJECT_XSD + "Win_User_Account/2.1/Win_User_Account_Object.xsd")
            .add(CYBOX_OBJECTS + "WinVolumeObject-2", "WinVolumeObj",
                    CYBOX_OBJECT_XSD + "Win_Volume/2.1/Win_Volume_Object.xsd")
            .add(CYBOX_OBJECTS + "WinWaitableTimerObject-2", "WinWaitableTimerObj",
                    CYBOX_OBJECT_XSD + "Win_Waitable_Timer/2.1/Win_Waitable_Timer_Object.xsd")
            .add(CYBOX_OBJECTS + "X509CertificateObject-2", "X509CertificateObj",
                    CYBOX_OBJECT_XSD + "X509_Certificate/2.1/X509_Certificate_Object.xsd")
            .build();

    /**
     * Namespaces not defined by STIX but used by its extensions. Only the
     * OASIS CIQ schemas are hosted on the STIX site.
     */
    public static final Vocabulary EXTENSIONS = Vocabulary.builder("STIX extensions")
            .add("http://capec.mitre.org/capec-2", "capec")
            .add("http://maec.mitre.org/XMLSchema/maec-package-2", "maecPackage")
            .add("http://oval.mitre.org/XMLSchema/oval-definitions-5", "oval-def")
            .add("http://oval.mitre.org/XMLSchema/oval-variables-5", "oval-var")
            .add("http://schemas.mandiant.com/2010/ioc", "ioc")
            .add("http://schemas.mandiant.com/2010/ioc/TR/", "ioc-tr")
            .add("http://www.icasi.org/CVRF/schema/cvrf/1.1", "cvrf")
            .add("urn:oasis:names:tc:ciq:xal:3", "xal", STIX_XSD + "external/oasis_ciq_3.0/xAL.xsd")
            .add("urn:oasis:names:tc:ciq:xpil:3", "xpil", STIX_XSD + "external/oasis_ciq_3.0/xPIL.xsd")
            .add("urn:oasis:names:tc:ciq:xnl:3", "xnl", STIX_XSD + "external/oasis_ciq_3.0/xNL.xsd")
            .build();

}
